/**
 * 패턴 공통 유틸리티.
 */
package com.ryuqq.agentica.pattern.support;
