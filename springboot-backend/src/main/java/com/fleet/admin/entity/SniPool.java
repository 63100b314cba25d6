package com.fleet.admin.entity;

import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class SniPool extends BaseEntity {

    private static final long serialVersionUID = 1L;

    private String domain;

    private Integer tier;

    private Integer healthScore;

    private Boolean isActive;

    private Boolean isPremium;

    private Long discoveredByNodeId;

}
