package com.fleet.admin.common.dto.inbound;

import com.fleet.admin.common.enums.InboundProtocol;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = false)
public class TrojanSettings extends InboundSettings {

    private List<Client> clients = new ArrayList<>();

    @Override
    public InboundProtocol protocol() {
        return InboundProtocol.TROJAN;
    }

    @Override
    public int userCount() {
        return clients == null ? 0 : clients.size();
    }

    @Data
    public static class Client {
        private String password;
        private String email;
    }
}
