package com.fleet.admin.common.dto;

import com.alibaba.fastjson.JSONObject;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NodeConfigDto {

    // 配置内容的 sha256，节点据此判断是否需要重载
    private String hash;

    private JSONObject content;

}
