package com.fleet.admin;

import cn.hutool.crypto.digest.DigestUtil;
import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONObject;
import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.fleet.admin.common.dto.NodeConfigDto;
import com.fleet.admin.common.lang.R;
import com.fleet.admin.common.utils.KeyUtil;
import com.fleet.admin.entity.Inbound;
import com.fleet.admin.entity.InboundTemplate;
import com.fleet.admin.entity.Node;
import com.fleet.admin.entity.NodeGroup;
import com.fleet.admin.entity.NodeGroupMember;
import com.fleet.admin.entity.NodePinnedSni;
import com.fleet.admin.entity.PlanGroup;
import com.fleet.admin.entity.PlanNode;
import com.fleet.admin.entity.SniPool;
import com.fleet.admin.entity.Subscription;
import com.fleet.admin.entity.SysConfig;
import com.fleet.admin.entity.User;
import com.fleet.admin.mapper.InboundMapper;
import com.fleet.admin.mapper.InboundTemplateMapper;
import com.fleet.admin.mapper.NodeGroupMapper;
import com.fleet.admin.mapper.NodeGroupMemberMapper;
import com.fleet.admin.mapper.NodeMapper;
import com.fleet.admin.mapper.NodePinnedSniMapper;
import com.fleet.admin.mapper.PlanGroupMapper;
import com.fleet.admin.mapper.PlanNodeMapper;
import com.fleet.admin.mapper.SniPoolMapper;
import com.fleet.admin.mapper.SubscriptionMapper;
import com.fleet.admin.mapper.SysConfigMapper;
import com.fleet.admin.mapper.UserMapper;
import com.fleet.admin.service.NodeConfigService;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import javax.annotation.Resource;
import java.util.ArrayList;
import java.util.List;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class NodeConfigIntegrationTest {

    private static final String SUBSCRIPTION_UUID = "0f8e9d7c-aaaa-bbbb-cccc-000011112222";

    @Resource
    private NodeConfigService nodeConfigService;

    @Resource
    private NodeMapper nodeMapper;

    @Resource
    private NodeGroupMapper nodeGroupMapper;

    @Resource
    private NodeGroupMemberMapper nodeGroupMemberMapper;

    @Resource
    private InboundTemplateMapper inboundTemplateMapper;

    @Resource
    private InboundMapper inboundMapper;

    @Resource
    private PlanGroupMapper planGroupMapper;

    @Resource
    private PlanNodeMapper planNodeMapper;

    @Resource
    private SubscriptionMapper subscriptionMapper;

    @Resource
    private SniPoolMapper sniPoolMapper;

    @Resource
    private NodePinnedSniMapper nodePinnedSniMapper;

    @Resource
    private UserMapper userMapper;

    @Resource
    private SysConfigMapper sysConfigMapper;

    @Test
    void defaultGroupBootstrapsRealityTemplateOnce() {
        Long groupId = createGroup("Default");
        Node node = createNode("edge-1", null);
        join(node, groupId);

        NodeConfigDto first = nodeConfigService.generateNodeConfig(node.getId());
        nodeConfigService.generateNodeConfig(node.getId());

        List<InboundTemplate> templates = inboundTemplateMapper.selectList(
                new QueryWrapper<InboundTemplate>().eq("target_group_id", groupId));
        Assertions.assertEquals(1, templates.size());
        Assertions.assertEquals("VLESS Reality", templates.get(0).getName());

        List<Inbound> inbounds = inboundsOf(node);
        Assertions.assertEquals(1, inbounds.size());
        Assertions.assertEquals(10000, inbounds.get(0).getListenPort());
        Assertions.assertEquals("tpl_" + templates.get(0).getId(), inbounds.get(0).getTag());

        Node healed = nodeMapper.selectById(node.getId());
        Assertions.assertTrue(KeyUtil.isValidPrivateKey(healed.getRealityPriv()));
        Assertions.assertTrue(inbounds.get(0).getStreamSettings().contains(healed.getRealityPriv()));

        // 没有订阅时入站被跳过
        Assertions.assertTrue(first.getContent().getJSONArray("inbounds").isEmpty());
    }

    @Test
    void subscribersAppearAsVlessClientsWithStableHash() {
        Long groupId = createGroup("Default");
        Node node = createNode("edge-2", null);
        join(node, groupId);
        subscribe(groupId, 1L, 12345L);

        NodeConfigDto first = nodeConfigService.generateNodeConfig(node.getId());
        NodeConfigDto second = nodeConfigService.generateNodeConfig(node.getId());

        JSONArray inbounds = first.getContent().getJSONArray("inbounds");
        Assertions.assertEquals(1, inbounds.size());
        JSONObject vless = inbounds.getJSONObject(0);
        Assertions.assertEquals("vless", vless.getString("type"));
        JSONObject user = vless.getJSONArray("users").getJSONObject(0);
        Assertions.assertEquals(SUBSCRIPTION_UUID, user.getString("uuid"));
        Assertions.assertEquals("xtls-rprx-vision", user.getString("flow"));
        Assertions.assertEquals("drive.google.com", vless.getJSONObject("tls").getString("server_name"));

        Node healed = nodeMapper.selectById(node.getId());
        Assertions.assertEquals(healed.getRealityPriv(),
                vless.getJSONObject("tls").getJSONObject("reality").getString("private_key"));

        Assertions.assertEquals(first.getHash(), second.getHash());
        Assertions.assertEquals(64, first.getHash().length());
    }

    @Test
    void relayChainLinksOutboundAndTargetUsers() {
        Long targetGroup = createGroup("Exit");
        Node target = createNode("exit-1", null);
        join(target, targetGroup);
        createTemplate(targetGroup, "Relay SS", "shadowsocks",
                "{\"method\":\"2022-blake3-aes-128-gcm\",\"password\":\"server-key\",\"users\":[]}", 8443, 8443);

        Node relay = createNode("relay-1", "relay-token");
        relay.setIsRelay(true);
        relay.setRelayId(target.getId());
        nodeMapper.updateById(relay);

        JSONObject targetConfig = nodeConfigService.generateNodeConfig(target.getId()).getContent();
        JSONObject ss = targetConfig.getJSONArray("inbounds").getJSONObject(0);
        Assertions.assertEquals(8443, ss.getIntValue("listen_port"));
        List<String> names = userNames(ss);
        Assertions.assertEquals(2, names.size());
        Assertions.assertTrue(names.contains("relay_" + relay.getId()));
        Assertions.assertTrue(names.contains("relay_" + relay.getId() + "_legacy"));

        JSONObject relayConfig = nodeConfigService.generateNodeConfig(relay.getId()).getContent();
        JSONObject relayOut = relayConfig.getJSONArray("outbounds").getJSONObject(1);
        Assertions.assertEquals("relay-out", relayOut.getString("tag"));
        Assertions.assertEquals("198.51.100.10", relayOut.getString("server"));
        Assertions.assertEquals(8443, relayOut.getIntValue("server_port"));
        Assertions.assertEquals("2022-blake3-aes-128-gcm", relayOut.getString("method"));
        Assertions.assertEquals(DigestUtil.sha256Hex("relay-token:relay:" + target.getId()), relayOut.getString("password"));

        JSONArray rules = relayConfig.getJSONObject("route").getJSONArray("rules");
        Assertions.assertEquals("relay-out", rules.getJSONObject(rules.size() - 1).getString("outbound"));
    }

    @Test
    void relayAuthModeFromSysConfigDropsLegacyUsers() {
        Long targetGroup = createGroup("Exit");
        Node target = createNode("exit-2", null);
        join(target, targetGroup);
        createTemplate(targetGroup, "Relay SS", "shadowsocks", "{\"method\":\"aes-128-gcm\",\"users\":[]}", 20000, 20010);
        Node relay = createNode("relay-2", "relay-token-2");
        relay.setIsRelay(true);
        relay.setRelayId(target.getId());
        nodeMapper.updateById(relay);

        SysConfig config = new SysConfig();
        config.setConfigKey("relay_auth_mode");
        config.setConfigValue("v1");
        config.setUpdatedTime(System.currentTimeMillis());
        sysConfigMapper.insert(config);

        JSONObject ss = nodeConfigService.generateNodeConfig(target.getId()).getContent()
                .getJSONArray("inbounds").getJSONObject(0);
        List<String> names = userNames(ss);
        Assertions.assertEquals(1, names.size());
        Assertions.assertEquals("relay_" + relay.getId(), names.get(0));
    }

    @Test
    void configByTokenRejectsUnknownToken() {
        R r = nodeConfigService.getConfigByToken("no-such-token");

        Assertions.assertEquals(401, r.getCode());
    }

    @Test
    void configByTokenServesEnabledNode() {
        Node node = createNode("edge-3", "edge-token");

        R r = nodeConfigService.getConfigByToken("edge-token");

        Assertions.assertEquals(R.SUCCESS_CODE, r.getCode());
        NodeConfigDto dto = (NodeConfigDto) r.getData();
        Assertions.assertNotNull(dto.getHash());
        Assertions.assertNull(nodeMapper.selectById(node.getId()).getRealityPriv());
    }

    @Test
    void pinnedSniAndNodePlanLinkReachWebsocketInbound() {
        Long groupId = createGroup("Edge");
        Node node = createNode("edge-4", null);
        join(node, groupId);
        createTemplate(groupId, "VLESS WS", "vless", "{\"clients\":[]}", 30000, 30100);
        InboundTemplate template = inboundTemplateMapper.selectList(
                new QueryWrapper<InboundTemplate>().eq("target_group_id", groupId)).get(0);
        template.setStreamSettingsTemplate("{\"network\":\"ws\",\"security\":\"none\","
                + "\"ws_settings\":{\"path\":\"/ws\",\"host\":\"{{SNI}}\"}}");
        inboundTemplateMapper.updateById(template);

        Long sniId = createSni("pinned.example.com", 0, 50);
        createSni("global.example.com", 0, 99);
        NodePinnedSni pinned = new NodePinnedSni();
        pinned.setNodeId(node.getId());
        pinned.setSniId(sniId);
        nodePinnedSniMapper.insert(pinned);

        subscribeUser(2L, 777L);
        PlanNode planNode = new PlanNode();
        planNode.setPlanId(2L);
        planNode.setNodeId(node.getId());
        planNodeMapper.insert(planNode);

        JSONObject vless = nodeConfigService.generateNodeConfig(node.getId()).getContent()
                .getJSONArray("inbounds").getJSONObject(0);

        int port = vless.getIntValue("listen_port");
        Assertions.assertTrue(port >= 30000 && port <= 30100);
        Assertions.assertFalse(vless.containsKey("tls"));
        Assertions.assertFalse(vless.getJSONArray("users").getJSONObject(0).containsKey("flow"));
        JSONObject transport = vless.getJSONObject("transport");
        Assertions.assertEquals("ws", transport.getString("type"));
        Assertions.assertEquals("pinned.example.com", transport.getJSONObject("headers").getString("Host"));
    }

    @Test
    void blockingPolicyOfNodeShapesDocument() {
        Node node = createNode("edge-5", null);
        node.setBlockAds(true);
        nodeMapper.updateById(node);

        JSONObject content = nodeConfigService.generateNodeConfig(node.getId()).getContent();

        JSONArray servers = content.getJSONObject("dns").getJSONArray("servers");
        Assertions.assertEquals("block", servers.getJSONObject(servers.size() - 1).getString("tag"));
        Assertions.assertEquals("geosite-ads",
                content.getJSONObject("route").getJSONArray("rule_set").getJSONObject(0).getString("tag"));
    }

    @Test
    void amneziaWgServerKeyAndHashSurviveRepeatedPulls() {
        Long groupId = createGroup("Awg");
        Node node = createNode("edge-6", null);
        join(node, groupId);
        createTemplate(groupId, "AWG", "amneziawg", "{\"users\":[]}", 51820, 51830);
        subscribe(groupId, 3L, 4242L);

        NodeConfigDto first = nodeConfigService.generateNodeConfig(node.getId());
        NodeConfigDto second = nodeConfigService.generateNodeConfig(node.getId());

        JSONObject awg1 = first.getContent().getJSONArray("inbounds").getJSONObject(0);
        JSONObject awg2 = second.getContent().getJSONArray("inbounds").getJSONObject(0);
        Assertions.assertEquals("amneziawg", awg1.getString("type"));
        Assertions.assertNotNull(awg1.getString("private_key"));
        Assertions.assertEquals(awg1.getString("private_key"), awg2.getString("private_key"));
        Assertions.assertEquals(awg1.getIntValue("jc"), awg2.getIntValue("jc"));
        Assertions.assertEquals(first.getHash(), second.getHash());
    }

    @Test
    void disabledInboundIsLeftOutOfNextDocument() {
        Long groupId = createGroup("Default");
        Node node = createNode("edge-7", null);
        join(node, groupId);
        subscribe(groupId, 4L, 999L);
        Assertions.assertEquals(1, nodeConfigService.generateNodeConfig(node.getId()).getContent()
                .getJSONArray("inbounds").size());

        Inbound inbound = inboundsOf(node).get(0);
        inbound.setEnable(false);
        inboundMapper.updateById(inbound);

        JSONArray inbounds = nodeConfigService.generateNodeConfig(node.getId()).getContent().getJSONArray("inbounds");

        Assertions.assertTrue(inbounds.isEmpty());
        Assertions.assertFalse(inboundMapper.selectById(inbound.getId()).getEnable());
    }

    private Long createGroup(String name) {
        NodeGroup group = new NodeGroup();
        group.setName(name);
        group.setCreatedTime(System.currentTimeMillis());
        nodeGroupMapper.insert(group);
        return group.getId();
    }

    private Node createNode(String name, String joinToken) {
        Node node = new Node();
        node.setName(name);
        node.setIp("198.51.100.10");
        node.setIsEnabled(true);
        node.setIsRelay(false);
        node.setJoinToken(joinToken);
        node.setCreatedTime(System.currentTimeMillis());
        nodeMapper.insert(node);
        return node;
    }

    private void join(Node node, Long groupId) {
        NodeGroupMember member = new NodeGroupMember();
        member.setNodeId(node.getId());
        member.setGroupId(groupId);
        member.setCreatedTime(System.currentTimeMillis());
        nodeGroupMemberMapper.insert(member);
    }

    private void createTemplate(Long groupId, String name, String protocol, String settings, int start, int end) {
        InboundTemplate template = new InboundTemplate();
        template.setName(name);
        template.setProtocol(protocol);
        template.setSettingsTemplate(settings);
        template.setTargetGroupId(groupId);
        template.setPortRangeStart(start);
        template.setPortRangeEnd(end);
        template.setRenewIntervalMins(0);
        template.setIsActive(true);
        template.setCreatedTime(System.currentTimeMillis());
        inboundTemplateMapper.insert(template);
    }

    private Long createSni(String domain, int tier, int healthScore) {
        SniPool sni = new SniPool();
        sni.setDomain(domain);
        sni.setTier(tier);
        sni.setHealthScore(healthScore);
        sni.setIsActive(true);
        sni.setIsPremium(false);
        sniPoolMapper.insert(sni);
        return sni.getId();
    }

    private void subscribe(Long groupId, Long planId, Long tgId) {
        subscribeUser(planId, tgId);

        PlanGroup planGroup = new PlanGroup();
        planGroup.setPlanId(planId);
        planGroup.setGroupId(groupId);
        planGroupMapper.insert(planGroup);
    }

    private void subscribeUser(Long planId, Long tgId) {
        User user = new User();
        user.setTgId(tgId);
        user.setUsername("tg_" + tgId);
        userMapper.insert(user);

        Subscription subscription = new Subscription();
        subscription.setUserId(user.getId());
        subscription.setPlanId(planId);
        subscription.setSubscriptionUuid(SUBSCRIPTION_UUID);
        subscription.setSubscriptionStatus("active");
        subscriptionMapper.insert(subscription);
    }

    private List<Inbound> inboundsOf(Node node) {
        return inboundMapper.selectList(new QueryWrapper<Inbound>().eq("node_id", node.getId()));
    }

    private List<String> userNames(JSONObject inbound) {
        List<String> names = new ArrayList<>();
        JSONArray users = inbound.getJSONArray("users");
        for (int i = 0; i < users.size(); i++) {
            names.add(users.getJSONObject(i).getString("name"));
        }
        return names;
    }
}
