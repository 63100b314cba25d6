package com.fleet.admin.service.impl;

import com.alibaba.fastjson.JSON;
import com.fleet.admin.common.dto.RelayOutboundDto;
import com.fleet.admin.common.dto.inbound.ShadowsocksSettings;
import com.fleet.admin.common.enums.RelayAuthMode;
import com.fleet.admin.common.utils.KeyUtil;
import com.fleet.admin.entity.Inbound;
import com.fleet.admin.entity.Node;
import com.fleet.admin.service.InboundService;
import com.fleet.admin.service.NodeService;
import com.fleet.admin.service.RelayChainService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import javax.annotation.Resource;
import java.util.ArrayList;
import java.util.List;

/**
 * 中转链路：中转节点的出站与目标节点的入站用户
 */
@Slf4j
@Service
public class RelayChainServiceImpl implements RelayChainService {

    public static final String RELAY_USER_PREFIX = "relay_";
    public static final String LEGACY_SUFFIX = "_legacy";

    @Resource
    private NodeService nodeService;

    @Resource
    private InboundService inboundService;

    @Override
    public RelayOutboundDto resolveRelayOutbound(Node node, RelayAuthMode mode) {
        if (!Boolean.TRUE.equals(node.getIsRelay())) {
            return null;
        }
        if (node.getRelayId() == null) {
            log.warn("节点 {} 开启了中转但未设置目标节点，跳过中转出站", node.getId());
            return null;
        }
        Node target = nodeService.getById(node.getRelayId());
        if (target == null || !Boolean.TRUE.equals(target.getIsEnabled())) {
            log.warn("节点 {} 的中转目标 {} 不存在或已禁用，跳过中转出站", node.getId(), node.getRelayId());
            return null;
        }
        String token = StringUtils.trimToNull(node.getJoinToken());
        if (token == null) {
            log.warn("节点 {} 开启了中转但缺少 join_token，跳过中转出站", node.getId());
            return null;
        }
        Inbound targetInbound = inboundService.findRelayTargetInbound(target.getId());
        if (targetInbound == null) {
            log.warn("节点 {} 的中转目标 {} 没有可用的 Shadowsocks 入站，跳过中转出站", node.getId(), target.getId());
            return null;
        }

        RelayOutboundDto outbound = new RelayOutboundDto();
        outbound.setTargetNodeId(target.getId());
        outbound.setServer(target.getIp());
        outbound.setServerPort(targetInbound.getListenPort());
        outbound.setMethod(parseMethod(targetInbound));
        outbound.setPassword(mode == RelayAuthMode.LEGACY ? token : KeyUtil.deriveRelayPassword(token, target.getId()));
        log.info("节点 {} 作为中转连接目标 {}({}:{})", node.getId(), target.getId(), target.getIp(), targetInbound.getListenPort());
        return outbound;
    }

    @Override
    public int injectRelayClients(Node target, ShadowsocksSettings settings, List<Node> relayClients, RelayAuthMode mode) {
        List<ShadowsocksSettings.User> users = new ArrayList<>();
        if (settings.getUsers() != null) {
            for (ShadowsocksSettings.User user : settings.getUsers()) {
                if (user.getUsername() == null || !user.getUsername().startsWith(RELAY_USER_PREFIX)) {
                    users.add(user);
                }
            }
        }

        int injected = 0;
        for (Node client : relayClients) {
            String token = StringUtils.trimToNull(client.getJoinToken());
            if (token == null) {
                log.warn("中转节点 {} 缺少 join_token，不注入中转用户", client.getId());
                continue;
            }
            String username = RELAY_USER_PREFIX + client.getId();
            switch (mode) {
                case LEGACY:
                    users.add(new ShadowsocksSettings.User(username, token));
                    injected++;
                    break;
                case V1:
                    users.add(new ShadowsocksSettings.User(username, KeyUtil.deriveRelayPassword(token, target.getId())));
                    injected++;
                    break;
                case DUAL:
                default:
                    users.add(new ShadowsocksSettings.User(username, KeyUtil.deriveRelayPassword(token, target.getId())));
                    users.add(new ShadowsocksSettings.User(username + LEGACY_SUFFIX, token));
                    injected += 2;
                    break;
            }
        }
        settings.setUsers(users);
        return injected;
    }

    private String parseMethod(Inbound inbound) {
        try {
            ShadowsocksSettings settings = JSON.parseObject(StringUtils.defaultIfBlank(inbound.getSettings(), "{}"), ShadowsocksSettings.class);
            if (settings != null && StringUtils.isNotBlank(settings.getMethod())) {
                return settings.getMethod().trim();
            }
        } catch (Exception e) {
            log.warn("中转目标入站 {} 的 settings 解析失败，使用默认加密方式: {}", inbound.getTag(), e.getMessage());
        }
        return ShadowsocksSettings.DEFAULT_METHOD;
    }
}
