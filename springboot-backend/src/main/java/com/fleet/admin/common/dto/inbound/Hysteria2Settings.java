package com.fleet.admin.common.dto.inbound;

import com.alibaba.fastjson.annotation.JSONField;
import com.fleet.admin.common.enums.InboundProtocol;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = false)
public class Hysteria2Settings extends InboundSettings {

    private List<User> users = new ArrayList<>();

    @JSONField(alternateNames = {"up_mbps"})
    private Integer upMbps;

    @JSONField(alternateNames = {"down_mbps"})
    private Integer downMbps;

    private Obfs obfs;

    private String masquerade;

    @Override
    public InboundProtocol protocol() {
        return InboundProtocol.HYSTERIA2;
    }

    @Override
    public int userCount() {
        return users == null ? 0 : users.size();
    }

    @Data
    public static class User {
        private String name;
        private String password;
    }

    @Data
    public static class Obfs {
        private String type;
        private String password;
    }
}
