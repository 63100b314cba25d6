package com.fleet.admin.service;

import com.fleet.admin.entity.Inbound;
import com.fleet.admin.entity.InboundTemplate;
import com.fleet.admin.entity.Node;
import com.baomidou.mybatisplus.extension.service.IService;

import java.util.List;

public interface InboundService extends IService<Inbound> {

    /**
     * 在节点的端口范围内随机分配未占用端口，范围会先规整到 [1, 65535]
     */
    int allocatePort(Long nodeId, Integer rangeStart, Integer rangeEnd);

    /**
     * 将模板实例化为节点上的入站，按 tag 幂等
     */
    Inbound materializeEndpoint(Node node, InboundTemplate template);

    List<Inbound> listByNode(Long nodeId);

    /**
     * 中转目标节点上端口最小的已启用 Shadowsocks 入站
     */
    Inbound findRelayTargetInbound(Long targetNodeId);

    /**
     * 重新分配端口与 SNI，并重新渲染模板
     */
    Inbound rotateInbound(Long inboundId);

    void removeByTemplate(Long templateId);
}
