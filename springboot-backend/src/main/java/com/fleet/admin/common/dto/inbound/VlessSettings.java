package com.fleet.admin.common.dto.inbound;

import com.fleet.admin.common.enums.InboundProtocol;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = false)
public class VlessSettings extends InboundSettings {

    private List<Client> clients = new ArrayList<>();

    private String decryption = "none";

    @Override
    public InboundProtocol protocol() {
        return InboundProtocol.VLESS;
    }

    @Override
    public int userCount() {
        return clients == null ? 0 : clients.size();
    }

    @Data
    public static class Client {
        private String id;
        private String flow;
        private String email;
    }
}
