package com.fleet.admin.controller;

import com.fleet.admin.common.lang.R;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * <p>
 * 节点配置：管理端预览与节点拉取
 * </p>
 */
@RestController
@CrossOrigin
public class NodeConfigController extends BaseController {

    public static final String NODE_TOKEN_HEADER = "X-Node-Token";

    @PostMapping("/api/v1/node/config")
    public R preview(@RequestBody Map<String, Object> params) {
        Long nodeId = Long.valueOf(params.get("id").toString());
        return nodeConfigService.getNodeConfig(nodeId);
    }

    @GetMapping("/api/v2/node/config")
    public R pull(@RequestHeader(value = NODE_TOKEN_HEADER, required = false) String joinToken) {
        return nodeConfigService.getConfigByToken(joinToken);
    }

}
