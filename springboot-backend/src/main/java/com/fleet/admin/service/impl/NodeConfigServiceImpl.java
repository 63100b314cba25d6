package com.fleet.admin.service.impl;

import cn.hutool.crypto.digest.DigestUtil;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONObject;
import com.fleet.admin.common.config.FleetProperties;
import com.fleet.admin.common.dto.NodeConfigDto;
import com.fleet.admin.common.dto.RelayOutboundDto;
import com.fleet.admin.common.dto.inbound.InboundSettings;
import com.fleet.admin.common.dto.inbound.ShadowsocksSettings;
import com.fleet.admin.common.dto.inbound.StreamSettings;
import com.fleet.admin.common.enums.InboundProtocol;
import com.fleet.admin.common.enums.RelayAuthMode;
import com.fleet.admin.common.exception.FleetException;
import com.fleet.admin.common.lang.R;
import com.fleet.admin.common.utils.SingBoxUtil;
import com.fleet.admin.entity.Inbound;
import com.fleet.admin.entity.InboundTemplate;
import com.fleet.admin.entity.Node;
import com.fleet.admin.service.ConfigValidateService;
import com.fleet.admin.service.InboundService;
import com.fleet.admin.service.InboundTemplateService;
import com.fleet.admin.service.NodeConfigService;
import com.fleet.admin.service.NodeService;
import com.fleet.admin.service.RelayChainService;
import com.fleet.admin.service.SysConfigService;
import com.fleet.admin.service.UserInjectionService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import javax.annotation.Resource;
import java.util.List;

/**
 * <p>
 * 节点配置生成
 * 修复密钥 → 实例化模板 → 注入用户 → 中转链路 → 组装 → 校验
 * </p>
 */
@Slf4j
@Service
public class NodeConfigServiceImpl implements NodeConfigService {

    @Resource
    private NodeService nodeService;

    @Resource
    private InboundService inboundService;

    @Resource
    private InboundTemplateService inboundTemplateService;

    @Resource
    private UserInjectionService userInjectionService;

    @Resource
    private RelayChainService relayChainService;

    @Resource
    private SysConfigService sysConfigService;

    @Resource
    private ConfigValidateService configValidateService;

    @Resource
    private FleetProperties fleetProperties;

    @Override
    public NodeConfigDto generateNodeConfig(Long nodeId) {
        Node node = nodeService.getById(nodeId);
        if (node == null) {
            throw new FleetException("节点不存在");
        }
        RelayAuthMode mode = sysConfigService.getRelayAuthMode();

        // 1. 模板与密钥
        List<InboundTemplate> templates = inboundTemplateService.resolveTemplates(node);
        nodeService.healRealityKeys(node, usesReality(templates, inboundService.listByNode(nodeId)));
        for (InboundTemplate template : templates) {
            inboundService.materializeEndpoint(node, template);
        }

        // 2. 入站与用户
        List<Node> relayClients = nodeService.getRelayClients(nodeId);
        JSONArray inbounds = new JSONArray();
        for (Inbound inbound : inboundService.listByNode(nodeId)) {
            JSONObject json = buildInbound(node, inbound, relayClients, mode);
            if (json != null) {
                inbounds.add(json);
            }
        }

        // 3. 中转出站与组装
        RelayOutboundDto relay = relayChainService.resolveRelayOutbound(node, mode);
        JSONObject document = SingBoxUtil.buildDocument(node, inbounds, relay, fleetProperties.getSingbox());

        configValidateService.validate(document);
        String hash = DigestUtil.sha256Hex(JSON.toJSONString(document));
        log.info("节点 {} 配置生成完成：{} 个入站，中转 {}，hash {}", nodeId, inbounds.size(), relay != null, hash);
        return new NodeConfigDto(hash, document);
    }

    @Override
    public R getNodeConfig(Long nodeId) {
        return R.ok(generateNodeConfig(nodeId));
    }

    @Override
    public R getConfigByToken(String joinToken) {
        Node node = nodeService.getByJoinToken(joinToken);
        if (node == null) {
            return R.err(401, "节点凭据无效");
        }
        if (!Boolean.TRUE.equals(node.getIsEnabled())) {
            return R.err("节点已禁用");
        }
        return R.ok(generateNodeConfig(node.getId()));
    }

    private JSONObject buildInbound(Node node, Inbound inbound, List<Node> relayClients, RelayAuthMode mode) {
        InboundProtocol protocol = InboundProtocol.of(inbound.getProtocol());
        if (protocol == null) {
            log.warn("入站 {} 的协议 {} 不受支持，跳过", inbound.getTag(), inbound.getProtocol());
            return null;
        }

        InboundSettings settings;
        StreamSettings stream;
        try {
            settings = protocol.parseSettings(inbound.getSettings());
            stream = StringUtils.isBlank(inbound.getStreamSettings())
                    ? new StreamSettings()
                    : JSON.parseObject(inbound.getStreamSettings(), StreamSettings.class);
            userInjectionService.injectUsers(node, inbound, settings);
        } catch (Exception e) {
            log.error("入站 {} 的配置解析失败，跳过: {}", inbound.getTag(), e.getMessage());
            return null;
        }

        if (protocol == InboundProtocol.SHADOWSOCKS && Boolean.TRUE.equals(inbound.getEnable())) {
            relayChainService.injectRelayClients(node, (ShadowsocksSettings) settings, relayClients, mode);
        }
        return SingBoxUtil.buildInbound(inbound, settings, stream, node, fleetProperties.getSingbox());
    }

    private boolean usesReality(List<InboundTemplate> templates, List<Inbound> inbounds) {
        for (InboundTemplate template : templates) {
            InboundProtocol protocol = InboundProtocol.of(template.getProtocol());
            if ((protocol != null && protocol.usesRealityKeys()) || containsReality(template.getStreamSettingsTemplate())) {
                return true;
            }
        }
        for (Inbound inbound : inbounds) {
            if (containsReality(inbound.getStreamSettings())) {
                return true;
            }
        }
        return false;
    }

    private boolean containsReality(String streamSettings) {
        return streamSettings != null && streamSettings.toLowerCase().contains("reality");
    }
}
