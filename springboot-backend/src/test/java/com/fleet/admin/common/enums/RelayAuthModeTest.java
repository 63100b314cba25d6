package com.fleet.admin.common.enums;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class RelayAuthModeTest {

    @Test
    void parsesSettingValues() {
        Assertions.assertEquals(RelayAuthMode.LEGACY, RelayAuthMode.fromSetting(" Legacy "));
        Assertions.assertEquals(RelayAuthMode.V1, RelayAuthMode.fromSetting("v1"));
        Assertions.assertEquals(RelayAuthMode.V1, RelayAuthMode.fromSetting("hashed"));
        Assertions.assertEquals(RelayAuthMode.V1, RelayAuthMode.fromSetting("DERIVED"));
        Assertions.assertEquals(RelayAuthMode.DUAL, RelayAuthMode.fromSetting("dual"));
        Assertions.assertEquals(RelayAuthMode.DUAL, RelayAuthMode.fromSetting("whatever"));
        Assertions.assertEquals(RelayAuthMode.DUAL, RelayAuthMode.fromSetting(null));
    }

    @Test
    void protocolLookupAcceptsAliases() {
        Assertions.assertEquals(InboundProtocol.SHADOWSOCKS, InboundProtocol.of("ss"));
        Assertions.assertEquals(InboundProtocol.HYSTERIA2, InboundProtocol.of(" Hysteria2 "));
        Assertions.assertEquals(InboundProtocol.AMNEZIAWG, InboundProtocol.of("amneziawg"));
        Assertions.assertNull(InboundProtocol.of("vmess"));
        Assertions.assertNull(InboundProtocol.of(null));
    }
}
