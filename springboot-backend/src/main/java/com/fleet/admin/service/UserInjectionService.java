package com.fleet.admin.service;

import com.fleet.admin.common.dto.inbound.InboundSettings;
import com.fleet.admin.entity.Inbound;
import com.fleet.admin.entity.Node;

public interface UserInjectionService {

    /**
     * 用入站关联套餐下的有效订阅替换 settings 中的用户列表
     * 入站禁用或没有关联套餐时用户列表为空
     *
     * @return 注入的用户数量
     */
    int injectUsers(Node node, Inbound inbound, InboundSettings settings);
}
