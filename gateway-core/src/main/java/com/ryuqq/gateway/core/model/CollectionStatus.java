package com.ryuqq.gateway.core.model;

/**
 * 컬렉션 상태.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public enum CollectionStatus {

    /** 정상 */
    GREEN,

    /** 최적화 진행 중 */
    YELLOW,

    /** 오류로 인해 일부 기능 불가 */
    RED,

    /** 최적화 대기 중 */
    GREY
}
