/**
 * Blackboard 패턴.
 */
package com.ryuqq.agentica.pattern.blackboard;
