package com.fleet.admin.common.exception;

import lombok.Getter;

@Getter
public class PortExhaustionException extends FleetException {

    private final Long nodeId;
    private final int rangeStart;
    private final int rangeEnd;

    public PortExhaustionException(Long nodeId, int rangeStart, int rangeEnd) {
        super(String.format("节点 %d 在端口范围 %d-%d 内无可用端口", nodeId, rangeStart, rangeEnd));
        this.nodeId = nodeId;
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
    }
}
