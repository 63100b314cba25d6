package com.fleet.admin.service.impl;

import cn.hutool.crypto.digest.DigestUtil;
import com.fleet.admin.common.dto.RelayOutboundDto;
import com.fleet.admin.common.dto.inbound.ShadowsocksSettings;
import com.fleet.admin.common.enums.RelayAuthMode;
import com.fleet.admin.entity.Inbound;
import com.fleet.admin.entity.Node;
import com.fleet.admin.service.InboundService;
import com.fleet.admin.service.NodeService;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

class RelayChainServiceImplTest {

    private RelayChainServiceImpl relayChainService;
    private NodeService nodeService;
    private InboundService inboundService;
    private Node relay;
    private Node target;

    @BeforeEach
    void setUp() {
        relayChainService = new RelayChainServiceImpl();
        nodeService = Mockito.mock(NodeService.class);
        inboundService = Mockito.mock(InboundService.class);
        ReflectionTestUtils.setField(relayChainService, "nodeService", nodeService);
        ReflectionTestUtils.setField(relayChainService, "inboundService", inboundService);

        target = new Node();
        target.setId(2L);
        target.setIp("198.51.100.2");
        target.setIsEnabled(true);

        relay = new Node();
        relay.setId(5L);
        relay.setIsRelay(true);
        relay.setRelayId(2L);
        relay.setJoinToken("relay-token");

        Inbound ss = new Inbound();
        ss.setTag("tpl_8");
        ss.setProtocol("shadowsocks");
        ss.setListenPort(8443);
        ss.setSettings("{\"method\":\"2022-blake3-aes-128-gcm\",\"users\":[]}");

        Mockito.when(nodeService.getById(2L)).thenReturn(target);
        Mockito.when(inboundService.findRelayTargetInbound(2L)).thenReturn(ss);
    }

    @Test
    void freshRelayUnderV1UsesDerivedPassword() {
        RelayOutboundDto outbound = relayChainService.resolveRelayOutbound(relay, RelayAuthMode.V1);

        Assertions.assertNotNull(outbound);
        Assertions.assertEquals("198.51.100.2", outbound.getServer());
        Assertions.assertEquals(8443, outbound.getServerPort());
        Assertions.assertEquals("2022-blake3-aes-128-gcm", outbound.getMethod());
        Assertions.assertEquals(DigestUtil.sha256Hex("relay-token:relay:2"), outbound.getPassword());
    }

    @Test
    void dualOutboundAlsoUsesDerivedPassword() {
        RelayOutboundDto outbound = relayChainService.resolveRelayOutbound(relay, RelayAuthMode.DUAL);

        Assertions.assertEquals(DigestUtil.sha256Hex("relay-token:relay:2"), outbound.getPassword());
    }

    @Test
    void legacyOutboundUsesRawToken() {
        RelayOutboundDto outbound = relayChainService.resolveRelayOutbound(relay, RelayAuthMode.LEGACY);

        Assertions.assertEquals("relay-token", outbound.getPassword());
    }

    @Test
    void missingTokenSkipsRelay() {
        relay.setJoinToken(null);
        Assertions.assertNull(relayChainService.resolveRelayOutbound(relay, RelayAuthMode.V1));

        relay.setJoinToken("   ");
        Assertions.assertNull(relayChainService.resolveRelayOutbound(relay, RelayAuthMode.V1));
    }

    @Test
    void missingTargetListenerSkipsRelay() {
        Mockito.when(inboundService.findRelayTargetInbound(2L)).thenReturn(null);

        Assertions.assertNull(relayChainService.resolveRelayOutbound(relay, RelayAuthMode.V1));
    }

    @Test
    void disabledTargetSkipsRelay() {
        target.setIsEnabled(false);

        Assertions.assertNull(relayChainService.resolveRelayOutbound(relay, RelayAuthMode.V1));
    }

    @Test
    void nonRelayNodeHasNoOutbound() {
        relay.setIsRelay(false);

        Assertions.assertNull(relayChainService.resolveRelayOutbound(relay, RelayAuthMode.V1));
    }

    @Test
    void methodDefaultsWhenTargetSettingsOmitIt() {
        Inbound ss = new Inbound();
        ss.setListenPort(9000);
        ss.setSettings("{\"users\":[]}");
        Mockito.when(inboundService.findRelayTargetInbound(2L)).thenReturn(ss);

        Assertions.assertEquals("chacha20-ietf-poly1305", relayChainService.resolveRelayOutbound(relay, RelayAuthMode.V1).getMethod());
    }

    @Test
    void dualInjectsDerivedAndLegacyUsers() {
        ShadowsocksSettings settings = new ShadowsocksSettings();
        settings.getUsers().add(new ShadowsocksSettings.User("user_1", "secret"));

        int injected = relayChainService.injectRelayClients(target, settings, clients(), RelayAuthMode.DUAL);

        Assertions.assertEquals(2, injected);
        Assertions.assertEquals(Arrays.asList("user_1", "relay_5", "relay_5_legacy"), usernames(settings));
        Assertions.assertEquals(DigestUtil.sha256Hex("relay-token:relay:2"), settings.getUsers().get(1).getPassword());
        Assertions.assertEquals("relay-token", settings.getUsers().get(2).getPassword());
    }

    @Test
    void switchingFromDualToV1DropsLegacyUsersOnly() {
        ShadowsocksSettings settings = new ShadowsocksSettings();
        settings.getUsers().add(new ShadowsocksSettings.User("user_1", "secret"));
        relayChainService.injectRelayClients(target, settings, clients(), RelayAuthMode.DUAL);
        String hashedUnderDual = settings.getUsers().get(1).getPassword();

        relayChainService.injectRelayClients(target, settings, clients(), RelayAuthMode.V1);

        Assertions.assertEquals(Arrays.asList("user_1", "relay_5"), usernames(settings));
        Assertions.assertEquals(hashedUnderDual, settings.getUsers().get(1).getPassword());
    }

    @Test
    void legacyInjectsRawTokenAndSkipsClientsWithoutToken() {
        Node noToken = new Node();
        noToken.setId(6L);
        List<Node> clients = new ArrayList<>(clients());
        clients.add(noToken);
        ShadowsocksSettings settings = new ShadowsocksSettings();

        relayChainService.injectRelayClients(target, settings, clients, RelayAuthMode.LEGACY);

        Assertions.assertEquals(1, settings.getUsers().size());
        Assertions.assertEquals("relay_5", settings.getUsers().get(0).getUsername());
        Assertions.assertEquals("relay-token", settings.getUsers().get(0).getPassword());
    }

    private List<Node> clients() {
        return Arrays.asList(relay);
    }

    private List<String> usernames(ShadowsocksSettings settings) {
        return settings.getUsers().stream().map(ShadowsocksSettings.User::getUsername).collect(Collectors.toList());
    }
}
