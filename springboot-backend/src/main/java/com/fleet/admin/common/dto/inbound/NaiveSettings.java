package com.fleet.admin.common.dto.inbound;

import com.fleet.admin.common.enums.InboundProtocol;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = false)
public class NaiveSettings extends InboundSettings {

    private List<User> users = new ArrayList<>();

    @Override
    public InboundProtocol protocol() {
        return InboundProtocol.NAIVE;
    }

    @Override
    public int userCount() {
        return users == null ? 0 : users.size();
    }

    @Data
    public static class User {
        private String username;
        private String password;
    }
}
