package com.fleet.admin.entity;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * <p>
 * 节点
 * status: 1 在线 0 离线；isEnabled 为软禁用开关
 * </p>
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class Node extends BaseEntity {

    private static final long serialVersionUID = 1L;

    private String name;

    private String ip;

    private String domain;

    private Boolean isEnabled;

    private Boolean isRelay;

    /** 中转目标节点 */
    private Long relayId;

    private String realityPriv;

    private String realityPub;

    private String shortId;

    private String realitySni;

    /** 节点接入凭据，同时作为中转认证的种子 */
    private String joinToken;

    private Boolean blockAds;

    private Boolean blockPorn;

    private Boolean blockTorrent;

}
