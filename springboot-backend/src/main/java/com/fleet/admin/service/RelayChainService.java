package com.fleet.admin.service;

import com.fleet.admin.common.dto.RelayOutboundDto;
import com.fleet.admin.common.dto.inbound.ShadowsocksSettings;
import com.fleet.admin.common.enums.RelayAuthMode;
import com.fleet.admin.entity.Node;

import java.util.List;

public interface RelayChainService {

    /**
     * 中转节点指向目标节点的出站，条件不满足时返回 null 并记录告警
     */
    RelayOutboundDto resolveRelayOutbound(Node node, RelayAuthMode mode);

    /**
     * 向目标节点的 Shadowsocks 入站注入中转客户端用户，之前注入的 relay_ 用户会被替换
     *
     * @return 注入的用户数量
     */
    int injectRelayClients(Node target, ShadowsocksSettings settings, List<Node> relayClients, RelayAuthMode mode);
}
