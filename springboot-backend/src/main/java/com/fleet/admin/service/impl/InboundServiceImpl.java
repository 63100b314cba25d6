package com.fleet.admin.service.impl;

import cn.hutool.core.lang.UUID;
import cn.hutool.core.util.RandomUtil;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONObject;
import com.alibaba.fastjson.parser.Feature;
import com.fleet.admin.common.enums.InboundProtocol;
import com.fleet.admin.common.enums.Placeholder;
import com.fleet.admin.common.exception.FleetException;
import com.fleet.admin.common.exception.PortExhaustionException;
import com.fleet.admin.common.utils.KeyUtil;
import com.fleet.admin.common.utils.PlaceholderUtil;
import com.fleet.admin.entity.Inbound;
import com.fleet.admin.entity.InboundTemplate;
import com.fleet.admin.entity.Node;
import com.fleet.admin.entity.PlanInbound;
import com.fleet.admin.mapper.InboundMapper;
import com.fleet.admin.mapper.InboundTemplateMapper;
import com.fleet.admin.mapper.NodeMapper;
import com.fleet.admin.mapper.PlanInboundMapper;
import com.fleet.admin.service.InboundService;
import com.fleet.admin.service.NodeService;
import com.fleet.admin.service.SniService;
import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import javax.annotation.Resource;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * <p>
 * 入站服务实现类：端口分配、模板实例化与轮换
 * </p>
 */
@Slf4j
@Service
public class InboundServiceImpl extends ServiceImpl<InboundMapper, Inbound> implements InboundService {

    // 常量定义
    public static final String TAG_PREFIX = "tpl_";
    private static final String DEFAULT_LISTEN_IP = "0.0.0.0";
    private static final int MIN_PORT = 1;
    private static final int MAX_PORT = 65535;
    private static final int PORT_PROBE_ATTEMPTS = 100;
    private static final int UPSERT_ATTEMPTS = 3;
    private static final int REALITY_DEFAULT_PORT = 443;
    private static final List<String> AWG_OBFUSCATION_KEYS = Arrays.asList("jc", "jmin", "jmax", "s1", "s2", "h1", "h2", "h3", "h4");

    @Resource
    private NodeService nodeService;

    @Resource
    private SniService sniService;

    @Resource
    private NodeMapper nodeMapper;

    @Resource
    private InboundTemplateMapper inboundTemplateMapper;

    @Resource
    private PlanInboundMapper planInboundMapper;

    @Override
    public int allocatePort(Long nodeId, Integer rangeStart, Integer rangeEnd) {
        PortRange range = PortRange.of(rangeStart, rangeEnd);
        Set<Integer> usedPorts = new HashSet<>(baseMapper.selectUsedPorts(nodeId));

        for (int i = 0; i < PORT_PROBE_ATTEMPTS; i++) {
            int candidate = RandomUtil.randomInt(range.getStart(), range.getEnd() + 1);
            if (!usedPorts.contains(candidate)) {
                return candidate;
            }
        }
        throw new PortExhaustionException(nodeId, range.getStart(), range.getEnd());
    }

    @Override
    public Inbound materializeEndpoint(Node node, InboundTemplate template) {
        InboundProtocol protocol = requireProtocol(template);
        String tag = TAG_PREFIX + template.getId();
        PortRange range = PortRange.of(template.getPortRangeStart(), template.getPortRangeEnd());

        if (protocol.usesRealityKeys() || usesReality(template.getStreamSettingsTemplate())) {
            nodeService.healRealityKeys(node, true);
        }
        String sni = sniService.getBestSni(node.getId());

        for (int attempt = 1; attempt <= UPSERT_ATTEMPTS; attempt++) {
            Inbound existing = findByTag(node.getId(), tag);
            int port;
            if (existing != null && existing.getListenPort() != null && range.contains(existing.getListenPort())) {
                port = existing.getListenPort();
            } else {
                if (existing != null) {
                    log.info("入站 {} 的端口 {} 不在模板范围 {}-{} 内，重新分配", tag, existing.getListenPort(), range.getStart(), range.getEnd());
                }
                port = allocatePort(node.getId(), range.getStart(), range.getEnd());
            }

            Inbound inbound = existing != null ? existing : new Inbound();
            String previousSettings = existing != null ? existing.getSettings() : null;
            inbound.setNodeId(node.getId());
            inbound.setTemplateId(template.getId());
            inbound.setTag(tag);
            inbound.setProtocol(protocol.getValue());
            inbound.setListenPort(port);
            inbound.setRemark(template.getName());
            if (existing == null || inbound.getEnable() == null) {
                inbound.setEnable(true);
            }
            if (StringUtils.isBlank(inbound.getListenIp())) {
                inbound.setListenIp(DEFAULT_LISTEN_IP);
            }
            render(inbound, node, template, protocol, sni, previousSettings);

            try {
                long now = System.currentTimeMillis();
                inbound.setUpdatedTime(now);
                if (existing == null) {
                    inbound.setCreatedTime(now);
                    inbound.setStatus(1);
                    this.save(inbound);
                } else {
                    this.updateById(inbound);
                }
                return inbound;
            } catch (DuplicateKeyException e) {
                log.warn("节点 {} 入站 {} 写入冲突（端口 {}），第 {} 次重试", node.getId(), tag, port, attempt);
            }
        }
        throw new FleetException("节点 " + node.getId() + " 实例化模板 " + template.getId() + " 失败：端口冲突重试次数已用尽");
    }

    @Override
    public List<Inbound> listByNode(Long nodeId) {
        return this.list(new QueryWrapper<Inbound>().eq("node_id", nodeId).orderByAsc("listen_port"));
    }

    @Override
    public Inbound findRelayTargetInbound(Long targetNodeId) {
        List<Inbound> candidates = this.list(new QueryWrapper<Inbound>()
                .eq("node_id", targetNodeId)
                .eq("enable", true)
                .in("protocol", Arrays.asList("shadowsocks", "ss"))
                .orderByAsc("listen_port"));
        return candidates.isEmpty() ? null : candidates.get(0);
    }

    @Override
    public Inbound rotateInbound(Long inboundId) {
        Inbound inbound = this.getById(inboundId);
        if (inbound == null) {
            throw new FleetException("入站不存在");
        }
        if (inbound.getTag() == null || !inbound.getTag().startsWith(TAG_PREFIX)) {
            throw new FleetException("入站 " + inbound.getTag() + " 不是由模板生成的，无法轮换");
        }
        Node node = nodeMapper.selectById(inbound.getNodeId());
        if (node == null) {
            throw new FleetException("节点不存在");
        }
        InboundTemplate template = findTemplate(inbound);
        if (template == null) {
            throw new FleetException("入站 " + inbound.getTag() + " 对应的模板不存在");
        }
        InboundProtocol protocol = requireProtocol(template);
        if (protocol.usesRealityKeys() || usesReality(template.getStreamSettingsTemplate())) {
            nodeService.healRealityKeys(node, true);
        }

        for (int attempt = 1; attempt <= UPSERT_ATTEMPTS; attempt++) {
            int port = allocatePort(node.getId(), template.getPortRangeStart(), template.getPortRangeEnd());
            String sni = sniService.getBestSni(node.getId());
            long now = System.currentTimeMillis();
            inbound.setListenPort(port);
            inbound.setLastRotatedTime(now);
            inbound.setUpdatedTime(now);
            render(inbound, node, template, protocol, sni, null);
            try {
                this.updateById(inbound);
                log.info("入站 {} 已轮换至端口 {}，SNI {}", inbound.getTag(), port, sni);
                return inbound;
            } catch (DuplicateKeyException e) {
                log.warn("入站 {} 轮换端口 {} 冲突，第 {} 次重试", inbound.getTag(), port, attempt);
            }
        }
        throw new FleetException("入站 " + inbound.getTag() + " 轮换失败：端口冲突重试次数已用尽");
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void removeByTemplate(Long templateId) {
        List<Inbound> inbounds = this.list(new QueryWrapper<Inbound>().eq("template_id", templateId));
        if (inbounds.isEmpty()) {
            return;
        }
        List<Long> ids = inbounds.stream().map(Inbound::getId).collect(Collectors.toList());
        planInboundMapper.delete(new QueryWrapper<PlanInbound>().in("inbound_id", ids));
        baseMapper.deleteBatchIds(ids);
        log.info("模板 {} 已删除，同时移除 {} 个入站", templateId, ids.size());
    }

    // ========== 模板渲染 ==========

    /**
     * previousSettings 为入站当前保存的 settings，AmneziaWG 服务端密钥与混淆参数沿用其中的值；
     * 为 null 时（新建或轮换）重新生成
     */
    private void render(Inbound inbound, Node node, InboundTemplate template, InboundProtocol protocol,
                        String sni, String previousSettings) {
        Map<Placeholder, String> values = new EnumMap<>(Placeholder.class);
        values.put(Placeholder.PORT, String.valueOf(inbound.getListenPort()));
        values.put(Placeholder.UUID, templateUuid(inbound));
        values.put(Placeholder.SNI, sni);
        values.put(Placeholder.DOMAIN, node.getDomain());
        values.put(Placeholder.REALITY_PRIVATE, node.getRealityPriv());
        values.put(Placeholder.REALITY_PBK, node.getRealityPub());
        values.put(Placeholder.REALITY_SID, node.getShortId());

        String settings = PlaceholderUtil.resolve(StringUtils.defaultIfBlank(template.getSettingsTemplate(), "{}"), values);
        String streamSettings = PlaceholderUtil.resolve(StringUtils.defaultIfBlank(template.getStreamSettingsTemplate(), "{}"), values);

        if (protocol == InboundProtocol.AMNEZIAWG) {
            settings = fillAmneziaWgParams(settings, previousSettings, inbound.getTag());
        }
        inbound.setSettings(settings);
        inbound.setStreamSettings(fillRealitySettings(streamSettings, node, sni, inbound.getTag()));
    }

    /**
     * Reality 配置缺省的密钥、short id、server name 与 dest 使用节点与 SNI 填充
     */
    private String fillRealitySettings(String streamSettings, Node node, String sni, String tag) {
        JSONObject stream = parseObject(streamSettings, tag);
        if (stream == null || !"reality".equalsIgnoreCase(StringUtils.trim(stream.getString("security")))) {
            return streamSettings;
        }

        String key = stream.containsKey("realitySettings") ? "realitySettings" : "reality_settings";
        JSONObject reality = stream.getJSONObject(key);
        if (reality == null) {
            reality = new JSONObject(true);
            stream.put(key, reality);
        }
        fillIfBlank(reality, node.getRealityPriv(), "private_key", "privateKey");
        fillIfBlank(reality, node.getRealityPub(), "public_key", "publicKey");
        fillIfBlank(reality, sni + ":" + REALITY_DEFAULT_PORT, "dest");
        fillListIfBlank(reality, node.getShortId(), "short_ids", "shortIds");
        fillListIfBlank(reality, sni, "server_names", "serverNames");
        return JSON.toJSONString(stream);
    }

    /**
     * {{uuid}} 的取值：同一入站在两次轮换之间保持不变
     */
    private String templateUuid(Inbound inbound) {
        long epoch = inbound.getLastRotatedTime() == null ? 0L : inbound.getLastRotatedTime();
        String seed = inbound.getNodeId() + ":" + inbound.getTag() + ":" + epoch;
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private String fillAmneziaWgParams(String settings, String previousSettings, String tag) {
        JSONObject awg = parseObject(settings, tag);
        if (awg == null) {
            return settings;
        }
        JSONObject previous = StringUtils.isBlank(previousSettings) ? null : parseObject(previousSettings, tag);

        if (StringUtils.isBlank(awg.getString("private_key")) && StringUtils.isBlank(awg.getString("privateKey"))) {
            if (previous != null && StringUtils.isNotBlank(previous.getString("private_key"))) {
                awg.put("private_key", previous.getString("private_key"));
                awg.put("public_key", previous.getString("public_key"));
            } else {
                KeyUtil.X25519KeyPair serverKeys = KeyUtil.generateWireguardKeypair();
                awg.put("private_key", serverKeys.getPrivateKey());
                awg.put("public_key", serverKeys.getPublicKey());
            }
        }
        if (awg.get("jc") == null && previous != null && previous.get("jc") != null) {
            for (String key : AWG_OBFUSCATION_KEYS) {
                awg.put(key, previous.get(key));
            }
        } else if (awg.get("jc") == null) {
            awg.put("jc", RandomUtil.randomInt(3, 11));
            awg.put("jmin", RandomUtil.randomInt(40, 101));
            awg.put("jmax", RandomUtil.randomInt(500, 1001));
            awg.put("s1", RandomUtil.randomInt(20, 101));
            awg.put("s2", RandomUtil.randomInt(20, 101));
            awg.put("h1", RandomUtil.randomLong(1L, 0xFFFFFFFFL));
            awg.put("h2", RandomUtil.randomLong(1L, 0xFFFFFFFFL));
            awg.put("h3", RandomUtil.randomLong(1L, 0xFFFFFFFFL));
            awg.put("h4", RandomUtil.randomLong(1L, 0xFFFFFFFFL));
        }
        return JSON.toJSONString(awg);
    }

    private JSONObject parseObject(String json, String tag) {
        try {
            Object parsed = JSON.parse(json, Feature.OrderedField);
            if (parsed instanceof JSONObject) {
                return (JSONObject) parsed;
            }
            log.warn("入站 {} 的模板内容不是 JSON 对象，跳过补全", tag);
        } catch (Exception e) {
            log.warn("入站 {} 的模板内容解析失败，跳过补全: {}", tag, e.getMessage());
        }
        return null;
    }

    private void fillIfBlank(JSONObject target, String value, String... keys) {
        for (String key : keys) {
            if (StringUtils.isNotBlank(target.getString(key))) {
                return;
            }
        }
        if (StringUtils.isNotBlank(value)) {
            target.put(presentKey(target, keys), value);
        }
    }

    private void fillListIfBlank(JSONObject target, String value, String... keys) {
        for (String key : keys) {
            JSONArray array = target.getJSONArray(key);
            if (array != null && array.stream().anyMatch(item -> item != null && StringUtils.isNotBlank(item.toString()))) {
                return;
            }
        }
        if (StringUtils.isNotBlank(value)) {
            List<String> list = new ArrayList<>();
            list.add(value);
            target.put(presentKey(target, keys), list);
        }
    }

    private String presentKey(JSONObject target, String... keys) {
        for (String key : keys) {
            if (target.containsKey(key)) {
                return key;
            }
        }
        return keys[0];
    }

    // ========== 辅助方法 ==========

    private Inbound findByTag(Long nodeId, String tag) {
        return this.getOne(new QueryWrapper<Inbound>().eq("node_id", nodeId).eq("tag", tag), false);
    }

    private InboundTemplate findTemplate(Inbound inbound) {
        if (inbound.getTemplateId() != null) {
            return inboundTemplateMapper.selectById(inbound.getTemplateId());
        }
        String templateId = inbound.getTag().substring(TAG_PREFIX.length());
        return StringUtils.isNumeric(templateId) ? inboundTemplateMapper.selectById(Long.valueOf(templateId)) : null;
    }

    private InboundProtocol requireProtocol(InboundTemplate template) {
        InboundProtocol protocol = InboundProtocol.of(template.getProtocol());
        if (protocol == null) {
            throw new FleetException("模板 " + template.getName() + " 使用了不支持的协议: " + template.getProtocol());
        }
        return protocol;
    }

    private boolean usesReality(String streamSettingsTemplate) {
        return streamSettingsTemplate != null && streamSettingsTemplate.toLowerCase().contains("reality");
    }

    /**
     * 规整后的端口范围：起止颠倒时交换，并截断到 [1, 65535]
     */
    @Data
    public static class PortRange {
        private final int start;
        private final int end;

        public static PortRange of(Integer rangeStart, Integer rangeEnd) {
            int start = rangeStart == null ? MIN_PORT : rangeStart;
            int end = rangeEnd == null ? MAX_PORT : rangeEnd;
            if (start > end) {
                int tmp = start;
                start = end;
                end = tmp;
            }
            start = Math.max(MIN_PORT, Math.min(MAX_PORT, start));
            end = Math.max(MIN_PORT, Math.min(MAX_PORT, end));
            return new PortRange(start, end);
        }

        public boolean contains(int port) {
            return port >= start && port <= end;
        }
    }
}
