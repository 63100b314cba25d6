package com.fleet.admin.common.dto;

import lombok.Data;

/**
 * 中转节点指向目标节点的 Shadowsocks 出站
 */
@Data
public class RelayOutboundDto {

    private Long targetNodeId;

    private String server;

    private Integer serverPort;

    private String method;

    private String password;

}
