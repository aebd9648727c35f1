/**
 * EventDriven 패턴: 이벤트 타입 구독과 동시 전달.
 */
package com.ryuqq.agentica.pattern.eventdriven;
