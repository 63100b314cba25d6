package com.fleet.admin.entity;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * <p>
 * 节点上实际监听的入站
 * (node_id, listen_port) 与 (node_id, tag) 均唯一
 * </p>
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class Inbound extends BaseEntity {

    private static final long serialVersionUID = 1L;

    private Long nodeId;

    private Long templateId;

    private String tag;

    private String protocol;

    private String listenIp;

    private Integer listenPort;

    private String settings;

    private String streamSettings;

    private String remark;

    private Boolean enable;

    private Long lastRotatedTime;

}
