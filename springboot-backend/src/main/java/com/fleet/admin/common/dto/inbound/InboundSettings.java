package com.fleet.admin.common.dto.inbound;

import com.fleet.admin.common.enums.InboundProtocol;

/**
 * 入站 settings 的公共父类，各协议子类持有自己的用户列表
 */
public abstract class InboundSettings {

    public abstract InboundProtocol protocol();

    public abstract int userCount();
}
