package com.fleet.admin.common.utils;

import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONObject;
import com.fleet.admin.common.config.FleetProperties;
import com.fleet.admin.common.dto.RelayOutboundDto;
import com.fleet.admin.common.dto.inbound.AmneziaWgSettings;
import com.fleet.admin.common.dto.inbound.Hysteria2Settings;
import com.fleet.admin.common.dto.inbound.InboundSettings;
import com.fleet.admin.common.dto.inbound.NaiveSettings;
import com.fleet.admin.common.dto.inbound.ShadowsocksSettings;
import com.fleet.admin.common.dto.inbound.StreamSettings;
import com.fleet.admin.common.dto.inbound.TrojanSettings;
import com.fleet.admin.common.dto.inbound.TuicSettings;
import com.fleet.admin.common.dto.inbound.VlessSettings;
import com.fleet.admin.entity.Inbound;
import com.fleet.admin.entity.Node;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * sing-box 配置文档的组装
 */
@Slf4j
public class SingBoxUtil {

    public static final String DIRECT_TAG = "direct";
    public static final String RELAY_OUT_TAG = "relay-out";
    public static final String DNS_REMOTE_TAG = "google";
    public static final String DNS_LOCAL_TAG = "local";
    public static final String DNS_BLOCK_TAG = "block";
    private static final String DNS_SINKHOLE = "127.0.0.1";

    public static final String RULE_SET_ADS = "geosite-ads";
    public static final String RULE_SET_PORN = "geosite-porn";
    public static final String RULE_SET_P2P = "geosite-p2p";

    private static final List<String> TCP_ALPN = Arrays.asList("h2", "http/1.1");
    private static final List<String> QUIC_ALPN = Collections.singletonList("h3");
    private static final int DEFAULT_HANDSHAKE_PORT = 443;

    private SingBoxUtil() {
    }

    // ========== 文档 ==========

    public static JSONObject buildDocument(Node node, JSONArray inbounds, RelayOutboundDto relay, FleetProperties.SingBox props) {
        boolean blockAds = Boolean.TRUE.equals(node.getBlockAds());
        boolean blockPorn = Boolean.TRUE.equals(node.getBlockPorn());
        boolean blockTorrent = Boolean.TRUE.equals(node.getBlockTorrent());

        JSONObject document = new JSONObject(true);
        document.put("log", buildLog(props));
        document.put("dns", buildDns(props, blockAds, blockPorn, blockTorrent));
        document.put("inbounds", inbounds);
        document.put("outbounds", buildOutbounds(relay));
        document.put("route", buildRoute(props, relay != null, blockAds, blockPorn, blockTorrent));

        JSONObject clashApi = new JSONObject(true);
        clashApi.put("external_controller", props.getClashApiController());
        JSONObject experimental = new JSONObject(true);
        experimental.put("clash_api", clashApi);
        document.put("experimental", experimental);
        return document;
    }

    private static JSONObject buildLog(FleetProperties.SingBox props) {
        JSONObject log = new JSONObject(true);
        log.put("level", props.getLogLevel());
        log.put("timestamp", true);
        return log;
    }

    private static JSONObject buildDns(FleetProperties.SingBox props, boolean blockAds, boolean blockPorn, boolean blockTorrent) {
        JSONArray servers = new JSONArray();
        JSONObject remote = new JSONObject(true);
        remote.put("type", "udp");
        remote.put("tag", DNS_REMOTE_TAG);
        remote.put("server", props.getDnsServer());
        servers.add(remote);

        JSONObject local = new JSONObject(true);
        local.put("type", "local");
        local.put("tag", DNS_LOCAL_TAG);
        local.put("detour", DIRECT_TAG);
        servers.add(local);

        if (blockAds || blockPorn || blockTorrent) {
            JSONObject sinkhole = new JSONObject(true);
            sinkhole.put("type", "udp");
            sinkhole.put("tag", DNS_BLOCK_TAG);
            sinkhole.put("server", DNS_SINKHOLE);
            servers.add(sinkhole);
        }

        JSONArray rules = new JSONArray();
        if (blockAds) {
            rules.add(dnsBlockRule(RULE_SET_ADS));
        }
        if (blockPorn) {
            rules.add(dnsBlockRule(RULE_SET_PORN));
        }

        JSONObject dns = new JSONObject(true);
        dns.put("servers", servers);
        dns.put("rules", rules);
        dns.put("final", DNS_LOCAL_TAG);
        return dns;
    }

    private static JSONObject dnsBlockRule(String ruleSet) {
        JSONObject rule = new JSONObject(true);
        rule.put("rule_set", Collections.singletonList(ruleSet));
        rule.put("server", DNS_BLOCK_TAG);
        return rule;
    }

    private static JSONArray buildOutbounds(RelayOutboundDto relay) {
        JSONArray outbounds = new JSONArray();
        JSONObject direct = new JSONObject(true);
        direct.put("type", "direct");
        direct.put("tag", DIRECT_TAG);
        outbounds.add(direct);

        if (relay != null) {
            JSONObject relayOut = new JSONObject(true);
            relayOut.put("type", "shadowsocks");
            relayOut.put("tag", RELAY_OUT_TAG);
            relayOut.put("server", relay.getServer());
            relayOut.put("server_port", relay.getServerPort());
            relayOut.put("method", relay.getMethod());
            relayOut.put("password", relay.getPassword());
            outbounds.add(relayOut);
        }
        return outbounds;
    }

    private static JSONObject buildRoute(FleetProperties.SingBox props, boolean hasRelay,
                                         boolean blockAds, boolean blockPorn, boolean blockTorrent) {
        JSONArray rules = new JSONArray();
        JSONArray ruleSets = new JSONArray();

        JSONObject dnsRule = new JSONObject(true);
        dnsRule.put("action", "route");
        dnsRule.put("protocol", Collections.singletonList("dns"));
        dnsRule.put("outbound", DIRECT_TAG);
        rules.add(dnsRule);

        if (blockTorrent) {
            JSONObject torrentRule = new JSONObject(true);
            torrentRule.put("action", "reject");
            torrentRule.put("protocol", Collections.singletonList("bittorrent"));
            rules.add(torrentRule);
            ruleSets.add(remoteRuleSet(props, RULE_SET_P2P, "geosite-category-p2p.srs"));
            rules.add(rejectRuleSet(RULE_SET_P2P));
        }
        if (blockAds) {
            ruleSets.add(remoteRuleSet(props, RULE_SET_ADS, "geosite-category-ads-all.srs"));
            rules.add(rejectRuleSet(RULE_SET_ADS));
        }
        if (blockPorn) {
            ruleSets.add(remoteRuleSet(props, RULE_SET_PORN, "geosite-category-porn.srs"));
            rules.add(rejectRuleSet(RULE_SET_PORN));
        }
        if (hasRelay) {
            JSONObject defaultRule = new JSONObject(true);
            defaultRule.put("action", "route");
            defaultRule.put("outbound", RELAY_OUT_TAG);
            rules.add(defaultRule);
        }

        JSONObject route = new JSONObject(true);
        route.put("rules", rules);
        if (!ruleSets.isEmpty()) {
            route.put("rule_set", ruleSets);
        }
        route.put("default_domain_resolver", DNS_REMOTE_TAG);
        return route;
    }

    private static JSONObject remoteRuleSet(FleetProperties.SingBox props, String tag, String file) {
        JSONObject ruleSet = new JSONObject(true);
        ruleSet.put("type", "remote");
        ruleSet.put("tag", tag);
        ruleSet.put("format", "binary");
        ruleSet.put("url", StringUtils.removeEnd(props.getRuleSetBaseUrl(), "/") + "/" + file);
        ruleSet.put("download_detour", DIRECT_TAG);
        ruleSet.put("update_interval", "24h");
        return ruleSet;
    }

    private static JSONObject rejectRuleSet(String tag) {
        JSONObject rule = new JSONObject(true);
        rule.put("action", "reject");
        rule.put("rule_set", Collections.singletonList(tag));
        return rule;
    }

    // ========== 入站 ==========

    /**
     * 把入站翻译为 sing-box 入站，用户为空时返回 null
     */
    public static JSONObject buildInbound(Inbound inbound, InboundSettings settings, StreamSettings stream,
                                          Node node, FleetProperties.SingBox props) {
        if (settings.userCount() == 0) {
            log.warn("入站 {} 没有任何用户，跳过", inbound.getTag());
            return null;
        }
        StreamSettings streamSettings = stream == null ? new StreamSettings() : stream;
        JSONObject json = inboundHeader(settings.protocol().getValue(), inbound);

        switch (settings.protocol()) {
            case VLESS:
                fillVless(json, (VlessSettings) settings, streamSettings, node, props, inbound.getTag());
                break;
            case HYSTERIA2:
                fillHysteria2(json, (Hysteria2Settings) settings, streamSettings, node, props);
                break;
            case TROJAN:
                fillTrojan(json, (TrojanSettings) settings, streamSettings, node, props, inbound.getTag());
                break;
            case TUIC:
                fillTuic(json, (TuicSettings) settings, streamSettings, node, props);
                break;
            case NAIVE:
                fillNaive(json, (NaiveSettings) settings, streamSettings, node, props, inbound.getTag());
                break;
            case SHADOWSOCKS:
                fillShadowsocks(json, (ShadowsocksSettings) settings);
                break;
            case AMNEZIAWG:
                fillAmneziaWg(json, (AmneziaWgSettings) settings);
                break;
            default:
                return null;
        }
        return json;
    }

    private static JSONObject inboundHeader(String type, Inbound inbound) {
        JSONObject json = new JSONObject(true);
        json.put("type", type);
        json.put("tag", inbound.getTag());
        json.put("listen", StringUtils.defaultIfBlank(inbound.getListenIp(), "0.0.0.0"));
        json.put("listen_port", inbound.getListenPort());
        return json;
    }

    private static void fillVless(JSONObject json, VlessSettings settings, StreamSettings stream,
                                  Node node, FleetProperties.SingBox props, String tag) {
        JSONArray users = new JSONArray();
        for (VlessSettings.Client client : settings.getClients()) {
            JSONObject user = new JSONObject(true);
            user.put("name", client.getEmail());
            user.put("uuid", client.getId());
            if (StringUtils.isNotBlank(client.getFlow())) {
                user.put("flow", client.getFlow());
            }
            users.add(user);
        }
        json.put("users", users);
        putIfNotNull(json, "tls", buildStreamTls(stream, node, props, tag, false));
        putIfNotNull(json, "transport", buildTransport(stream));
        if (StringUtils.isNotBlank(stream.getPacketEncoding())) {
            json.put("packet_encoding", stream.getPacketEncoding());
        }
    }

    private static void fillTrojan(JSONObject json, TrojanSettings settings, StreamSettings stream,
                                   Node node, FleetProperties.SingBox props, String tag) {
        JSONArray users = new JSONArray();
        for (TrojanSettings.Client client : settings.getClients()) {
            JSONObject user = new JSONObject(true);
            user.put("name", client.getEmail());
            user.put("password", client.getPassword());
            users.add(user);
        }
        json.put("users", users);
        putIfNotNull(json, "tls", buildStreamTls(stream, node, props, tag, false));
        putIfNotNull(json, "transport", buildTransport(stream));
    }

    private static void fillNaive(JSONObject json, NaiveSettings settings, StreamSettings stream,
                                  Node node, FleetProperties.SingBox props, String tag) {
        JSONArray users = new JSONArray();
        for (NaiveSettings.User naiveUser : settings.getUsers()) {
            JSONObject user = new JSONObject(true);
            user.put("username", naiveUser.getUsername());
            user.put("password", naiveUser.getPassword());
            users.add(user);
        }
        json.put("users", users);
        if (stream.securityIs("reality")) {
            putIfNotNull(json, "tls", buildRealityTls(stream, node, props, tag));
        } else {
            json.put("tls", buildCertificateTls(stream.getTlsSettings(), props.getDefaultSni(), TCP_ALPN, props, true));
        }
    }

    private static void fillHysteria2(JSONObject json, Hysteria2Settings settings, StreamSettings stream,
                                      Node node, FleetProperties.SingBox props) {
        JSONArray users = new JSONArray();
        for (Hysteria2Settings.User hy2User : settings.getUsers()) {
            JSONObject user = new JSONObject(true);
            user.put("name", hy2User.getName());
            user.put("password", hy2User.getPassword());
            users.add(user);
        }
        json.put("users", users);
        putIfNotNull(json, "up_mbps", settings.getUpMbps());
        putIfNotNull(json, "down_mbps", settings.getDownMbps());
        if (settings.getObfs() != null && StringUtils.isNotBlank(settings.getObfs().getType())) {
            JSONObject obfs = new JSONObject(true);
            obfs.put("type", settings.getObfs().getType());
            obfs.put("password", settings.getObfs().getPassword());
            json.put("obfs", obfs);
        }
        if (StringUtils.isNotBlank(settings.getMasquerade())) {
            String masquerade = settings.getMasquerade().trim();
            if (!masquerade.contains("://") && masquerade.startsWith("/")) {
                masquerade = "file://" + masquerade;
            }
            json.put("masquerade", masquerade);
        }
        String serverName = StringUtils.defaultIfBlank(node.getRealitySni(), props.getDefaultSni());
        json.put("tls", buildCertificateTls(stream.getTlsSettings(), serverName, QUIC_ALPN, props, true));
    }

    private static void fillTuic(JSONObject json, TuicSettings settings, StreamSettings stream,
                                 Node node, FleetProperties.SingBox props) {
        JSONArray users = new JSONArray();
        for (TuicSettings.User tuicUser : settings.getUsers()) {
            JSONObject user = new JSONObject(true);
            user.put("name", tuicUser.getName());
            user.put("uuid", tuicUser.getUuid());
            user.put("password", tuicUser.getPassword());
            users.add(user);
        }
        json.put("users", users);
        putIfNotNull(json, "congestion_control", settings.getCongestionControl());
        putIfNotNull(json, "auth_timeout", settings.getAuthTimeout());
        putIfNotNull(json, "zero_rtt_handshake", settings.getZeroRttHandshake());
        putIfNotNull(json, "heartbeat", settings.getHeartbeat());
        String serverName = StringUtils.defaultIfBlank(node.getRealitySni(), props.getDefaultSni());
        json.put("tls", buildCertificateTls(stream.getTlsSettings(), serverName, QUIC_ALPN, props, true));
    }

    private static void fillShadowsocks(JSONObject json, ShadowsocksSettings settings) {
        json.put("method", StringUtils.defaultIfBlank(settings.getMethod(), ShadowsocksSettings.DEFAULT_METHOD));
        if (StringUtils.isNotBlank(settings.getPassword())) {
            json.put("password", settings.getPassword());
        }
        JSONArray users = new JSONArray();
        for (ShadowsocksSettings.User ssUser : settings.getUsers()) {
            JSONObject user = new JSONObject(true);
            user.put("name", ssUser.getUsername());
            user.put("password", ssUser.getPassword());
            users.add(user);
        }
        json.put("users", users);
    }

    private static void fillAmneziaWg(JSONObject json, AmneziaWgSettings settings) {
        json.put("private_key", settings.getPrivateKey());
        JSONArray peers = new JSONArray();
        for (AmneziaWgSettings.User awgUser : settings.getUsers()) {
            JSONObject peer = new JSONObject(true);
            peer.put("name", awgUser.getName());
            peer.put("public_key", awgUser.getPublicKey());
            putIfNotNull(peer, "preshared_key", awgUser.getPresharedKey());
            peer.put("allowed_ips", Collections.singletonList(awgUser.getClientIp()));
            peers.add(peer);
        }
        json.put("peers", peers);
        putIfNotNull(json, "jc", settings.getJc());
        putIfNotNull(json, "jmin", settings.getJmin());
        putIfNotNull(json, "jmax", settings.getJmax());
        putIfNotNull(json, "s1", settings.getS1());
        putIfNotNull(json, "s2", settings.getS2());
        putIfNotNull(json, "h1", settings.getH1());
        putIfNotNull(json, "h2", settings.getH2());
        putIfNotNull(json, "h3", settings.getH3());
        putIfNotNull(json, "h4", settings.getH4());
    }

    // ========== TLS / 传输层 ==========

    private static JSONObject buildStreamTls(StreamSettings stream, Node node, FleetProperties.SingBox props,
                                             String tag, boolean defaultCertificates) {
        if (stream.securityIs("reality")) {
            return buildRealityTls(stream, node, props, tag);
        }
        if (stream.securityIs("tls")) {
            return buildCertificateTls(stream.getTlsSettings(), props.getDefaultSni(), TCP_ALPN, props, defaultCertificates);
        }
        return null;
    }

    /**
     * Reality 私钥无效时返回 null，入站退化为无 TLS
     */
    static JSONObject buildRealityTls(StreamSettings stream, Node node, FleetProperties.SingBox props, String tag) {
        StreamSettings.RealitySettings reality = stream.getRealitySettings();
        if (reality == null) {
            return null;
        }
        String fallbackSni = StringUtils.defaultIfBlank(node.getRealitySni(), props.getDefaultSni());

        String serverName = firstNotBlank(reality.getServerNames());
        if (serverName == null) {
            serverName = fallbackSni;
        }

        String handshakeServer = fallbackSni;
        int handshakePort = DEFAULT_HANDSHAKE_PORT;
        String dest = StringUtils.trimToEmpty(reality.getDest());
        if (!dest.isEmpty()) {
            int idx = dest.lastIndexOf(':');
            if (idx > 0) {
                handshakeServer = dest.substring(0, idx);
                String port = dest.substring(idx + 1);
                handshakePort = StringUtils.isNumeric(port) ? Integer.parseInt(port) : DEFAULT_HANDSHAKE_PORT;
            } else {
                handshakeServer = dest;
            }
        }

        String privateKey = KeyUtil.normalizeRealityKey(
                StringUtils.isNotBlank(reality.getPrivateKey()) ? reality.getPrivateKey() : node.getRealityPriv());
        if (!KeyUtil.isValidPrivateKey(privateKey)) {
            log.warn("入站 {} 的 Reality 私钥无效或缺失（长度 {}），跳过 Reality 配置", tag, privateKey == null ? 0 : privateKey.length());
            return null;
        }

        List<String> shortIds = new ArrayList<>();
        if (reality.getShortIds() != null) {
            for (String shortId : reality.getShortIds()) {
                shortIds.add(StringUtils.trimToEmpty(shortId));
            }
        }
        if (shortIds.isEmpty() && StringUtils.isNotBlank(node.getShortId())) {
            shortIds.add(node.getShortId().trim());
        }

        JSONObject handshake = new JSONObject(true);
        handshake.put("server", handshakeServer);
        handshake.put("server_port", handshakePort);

        JSONObject realityJson = new JSONObject(true);
        realityJson.put("enabled", true);
        realityJson.put("handshake", handshake);
        realityJson.put("private_key", privateKey);
        realityJson.put("short_id", shortIds);

        JSONObject tls = new JSONObject(true);
        tls.put("enabled", true);
        tls.put("server_name", serverName);
        tls.put("alpn", TCP_ALPN);
        tls.put("reality", realityJson);
        return tls;
    }

    private static JSONObject buildCertificateTls(StreamSettings.TlsSettings tlsSettings, String defaultServerName,
                                                  List<String> alpn, FleetProperties.SingBox props, boolean defaultCertificates) {
        String serverName = defaultServerName;
        String certificatePath = null;
        String keyPath = null;
        if (tlsSettings != null) {
            if (StringUtils.isNotBlank(tlsSettings.getServerName())) {
                serverName = tlsSettings.getServerName();
            }
            if (tlsSettings.getCertificates() != null && !tlsSettings.getCertificates().isEmpty()) {
                StreamSettings.Certificate first = tlsSettings.getCertificates().get(0);
                certificatePath = StringUtils.trimToNull(first.getCertificatePath());
                keyPath = StringUtils.trimToNull(first.getKeyPath());
            }
        }
        if (defaultCertificates) {
            certificatePath = StringUtils.defaultIfBlank(certificatePath, props.getCertificatePath());
            keyPath = StringUtils.defaultIfBlank(keyPath, props.getKeyPath());
        }

        JSONObject tls = new JSONObject(true);
        tls.put("enabled", true);
        tls.put("server_name", serverName);
        tls.put("alpn", alpn);
        putIfNotNull(tls, "certificate_path", certificatePath);
        putIfNotNull(tls, "key_path", keyPath);
        return tls;
    }

    /**
     * ws / grpc / httpupgrade，xhttp 与 splithttp 按 httpupgrade 处理
     */
    static JSONObject buildTransport(StreamSettings stream) {
        String network = StringUtils.trimToEmpty(stream.getNetwork()).toLowerCase();
        StreamSettings.TransportSettings settings;
        JSONObject transport = new JSONObject(true);
        switch (network) {
            case "ws":
                settings = stream.getWsSettings();
                transport.put("type", "ws");
                if (settings != null) {
                    putIfNotBlank(transport, "path", settings.getPath());
                    Map<String, String> headers = settings.getHeaders();
                    if ((headers == null || headers.isEmpty()) && StringUtils.isNotBlank(settings.getHost())) {
                        headers = Collections.singletonMap("Host", settings.getHost());
                    }
                    if (headers != null && !headers.isEmpty()) {
                        transport.put("headers", headers);
                    }
                }
                return transport;
            case "grpc":
                settings = stream.getGrpcSettings();
                transport.put("type", "grpc");
                if (settings != null) {
                    putIfNotBlank(transport, "service_name", settings.getServiceName());
                }
                return transport;
            case "httpupgrade":
            case "xhttp":
            case "splithttp":
                settings = "httpupgrade".equals(network) ? stream.getHttpUpgradeSettings() : stream.getXhttpSettings();
                if (settings == null) {
                    settings = "httpupgrade".equals(network) ? stream.getXhttpSettings() : stream.getHttpUpgradeSettings();
                }
                transport.put("type", "httpupgrade");
                if (settings != null) {
                    putIfNotBlank(transport, "path", settings.getPath());
                    putIfNotBlank(transport, "host", settings.getHost());
                }
                return transport;
            default:
                return null;
        }
    }

    private static String firstNotBlank(List<String> values) {
        if (values == null) {
            return null;
        }
        for (String value : values) {
            if (StringUtils.isNotBlank(value)) {
                return value.trim();
            }
        }
        return null;
    }

    private static void putIfNotNull(JSONObject json, String key, Object value) {
        if (value != null) {
            json.put(key, value);
        }
    }

    private static void putIfNotBlank(JSONObject json, String key, String value) {
        if (StringUtils.isNotBlank(value)) {
            json.put(key, value.trim());
        }
    }
}
