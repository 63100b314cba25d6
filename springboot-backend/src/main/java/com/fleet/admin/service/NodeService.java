package com.fleet.admin.service;

import com.fleet.admin.entity.Node;
import com.baomidou.mybatisplus.extension.service.IService;

import java.util.List;

public interface NodeService extends IService<Node> {

    Node getByJoinToken(String joinToken);

    /**
     * 以指定节点为中转目标的已启用中转节点
     */
    List<Node> getRelayClients(Long targetNodeId);

    /**
     * 修复节点的 Reality 密钥
     *
     * @return 是否重新生成并保存了密钥
     */
    boolean healRealityKeys(Node node, boolean usesReality);
}
