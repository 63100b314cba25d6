package com.fleet.admin.service.impl;

import com.fleet.admin.common.utils.KeyUtil;
import com.fleet.admin.entity.Node;
import com.fleet.admin.mapper.NodeMapper;
import com.fleet.admin.service.NodeService;
import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;

/**
 * <p>
 * 节点服务实现类
 * </p>
 */
@Slf4j
@Service
public class NodeServiceImpl extends ServiceImpl<NodeMapper, Node> implements NodeService {

    @Override
    public Node getByJoinToken(String joinToken) {
        if (StringUtils.isBlank(joinToken)) {
            return null;
        }
        return this.getOne(new QueryWrapper<Node>().eq("join_token", joinToken.trim()), false);
    }

    @Override
    public List<Node> getRelayClients(Long targetNodeId) {
        if (targetNodeId == null) {
            return Collections.emptyList();
        }
        return this.list(new QueryWrapper<Node>()
                .eq("relay_id", targetNodeId)
                .eq("is_relay", true)
                .eq("is_enabled", true)
                .orderByAsc("id"));
    }

    @Override
    public boolean healRealityKeys(Node node, boolean usesReality) {
        String stored = node.getRealityPriv();
        if (stored != null && !stored.equals(stored.trim())) {
            node.setRealityPriv(stored.trim());
        }
        if (KeyUtil.isValidPrivateKey(node.getRealityPriv()) || !usesReality) {
            return false;
        }

        log.warn("节点 {} 的 Reality 私钥无效，重新生成", node.getId());
        KeyUtil.RealityKeys keys = KeyUtil.generateRealityKeypair();
        node.setRealityPriv(keys.getPrivateKey());
        node.setRealityPub(keys.getPublicKey());
        node.setShortId(keys.getShortId());
        node.setUpdatedTime(System.currentTimeMillis());
        this.updateById(node);
        return true;
    }
}
