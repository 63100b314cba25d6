package com.fleet.admin.common.dto.inbound;

import com.alibaba.fastjson.annotation.JSONField;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 入站传输层与 TLS 配置，兼容 xray 风格的驼峰字段与下划线字段
 */
@Data
public class StreamSettings {

    private String network;

    private String security;

    @JSONField(alternateNames = {"tls_settings"})
    private TlsSettings tlsSettings;

    @JSONField(alternateNames = {"reality_settings"})
    private RealitySettings realitySettings;

    @JSONField(alternateNames = {"ws_settings"})
    private TransportSettings wsSettings;

    @JSONField(alternateNames = {"grpc_settings"})
    private TransportSettings grpcSettings;

    @JSONField(alternateNames = {"http_upgrade_settings", "httpupgrade_settings", "httpupgradeSettings"})
    private TransportSettings httpUpgradeSettings;

    @JSONField(alternateNames = {"xhttp_settings", "splithttpSettings", "splithttp_settings"})
    private TransportSettings xhttpSettings;

    @JSONField(alternateNames = {"packet_encoding"})
    private String packetEncoding;

    public boolean securityIs(String value) {
        return security != null && security.trim().equalsIgnoreCase(value);
    }

    public boolean networkIs(String value) {
        return network != null && network.trim().equalsIgnoreCase(value);
    }

    @Data
    public static class RealitySettings {
        private Boolean show;
        private String dest;
        private Integer xver;
        @JSONField(alternateNames = {"server_names"})
        private List<String> serverNames = new ArrayList<>();
        @JSONField(alternateNames = {"private_key"})
        private String privateKey;
        @JSONField(alternateNames = {"public_key"})
        private String publicKey;
        @JSONField(alternateNames = {"short_ids"})
        private List<String> shortIds = new ArrayList<>();
    }

    @Data
    public static class TlsSettings {
        @JSONField(alternateNames = {"server_name"})
        private String serverName;
        private List<Certificate> certificates;
        private List<String> alpn;
    }

    @Data
    public static class Certificate {
        @JSONField(alternateNames = {"certificate_path", "certificateFile"})
        private String certificatePath;
        @JSONField(alternateNames = {"key_path", "keyFile"})
        private String keyPath;
    }

    @Data
    public static class TransportSettings {
        private String path;
        private String host;
        private Map<String, String> headers;
        @JSONField(alternateNames = {"service_name"})
        private String serviceName;
    }
}
