package com.fleet.admin.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "fleet")
public class FleetProperties {

    private SingBox singbox = new SingBox();

    private Relay relay = new Relay();

    private Rotation rotation = new Rotation();

    @Data
    public static class SingBox {
        /** sing-box 可执行文件，用于 check 校验 */
        private String binary = "sing-box";
        private int checkTimeoutSeconds = 5;
        private String logLevel = "info";
        private String dnsServer = "8.8.8.8";
        private String clashApiController = "127.0.0.1:9090";
        private String certificatePath = "/etc/sing-box/certs/cert.pem";
        private String keyPath = "/etc/sing-box/certs/key.pem";
        private String defaultSni = "www.google.com";
        private String ruleSetBaseUrl = "https://raw.githubusercontent.com/SagerNet/sing-geosite/rule-set";
    }

    @Data
    public static class Relay {
        /** legacy / v1 / dual，可被 sys_config 中的 relay_auth_mode 覆盖 */
        private String authMode = "dual";
    }

    @Data
    public static class Rotation {
        private boolean enabled = true;
        private long intervalMs = 60000;
    }
}
