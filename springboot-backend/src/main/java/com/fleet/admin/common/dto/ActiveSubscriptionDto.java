package com.fleet.admin.common.dto;

import lombok.Data;

/**
 * 套餐下的有效订阅，附带用户的 tg_id
 */
@Data
public class ActiveSubscriptionDto {

    private Long subscriptionId;

    private String subscriptionUuid;

    private Long userId;

    private Long tgId;

}
