package com.fleet.admin.entity;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * <p>
 * 用户订阅
 * subscriptionStatus: active / pending / expired，仅 active 参与下发
 * </p>
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class Subscription extends BaseEntity {

    private static final long serialVersionUID = 1L;

    private Long userId;

    private Long planId;

    /** 订阅密钥（UUID 格式），各协议凭据均由其派生 */
    private String subscriptionUuid;

    private String subscriptionStatus;

    private Long expireTime;

}
