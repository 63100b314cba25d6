package com.fleet.admin.service;

import com.fleet.admin.common.dto.NodeConfigDto;
import com.fleet.admin.common.lang.R;

public interface NodeConfigService {

    /**
     * 生成节点的完整 sing-box 配置及其内容哈希
     */
    NodeConfigDto generateNodeConfig(Long nodeId);

    R getNodeConfig(Long nodeId);

    R getConfigByToken(String joinToken);
}
