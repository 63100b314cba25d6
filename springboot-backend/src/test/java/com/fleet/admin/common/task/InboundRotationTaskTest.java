package com.fleet.admin.common.task;

import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.fleet.admin.common.config.FleetProperties;
import com.fleet.admin.entity.Inbound;
import com.fleet.admin.entity.InboundTemplate;
import com.fleet.admin.service.InboundService;
import com.fleet.admin.service.InboundTemplateService;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Arrays;
import java.util.Collections;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;

class InboundRotationTaskTest {

    private static final long NOW = 10_000_000L;

    private InboundRotationTask task;
    private InboundTemplateService inboundTemplateService;
    private InboundService inboundService;
    private FleetProperties fleetProperties;

    @BeforeEach
    void setUp() {
        task = new InboundRotationTask();
        inboundTemplateService = Mockito.mock(InboundTemplateService.class);
        inboundService = Mockito.mock(InboundService.class);
        fleetProperties = new FleetProperties();
        ReflectionTestUtils.setField(task, "inboundTemplateService", inboundTemplateService);
        ReflectionTestUtils.setField(task, "inboundService", inboundService);
        ReflectionTestUtils.setField(task, "fleetProperties", fleetProperties);

        InboundTemplate template = new InboundTemplate();
        template.setId(1L);
        template.setRenewIntervalMins(10);
        Mockito.when(inboundTemplateService.list(any(QueryWrapper.class))).thenReturn(Collections.singletonList(template));
    }

    @Test
    void rotatesOnlyExpiredInbounds() {
        Inbound fresh = inbound(1L, NOW - 5 * 60_000L, null);
        Inbound expired = inbound(2L, NOW - 30 * 60_000L, NOW - 11 * 60_000L);
        Inbound neverRotated = inbound(3L, NOW - 20 * 60_000L, null);
        Mockito.when(inboundService.list(any(QueryWrapper.class))).thenReturn(Arrays.asList(fresh, expired, neverRotated));

        Assertions.assertEquals(2, task.rotateExpiredInbounds(NOW));

        Mockito.verify(inboundService, Mockito.never()).rotateInbound(1L);
        Mockito.verify(inboundService).rotateInbound(2L);
        Mockito.verify(inboundService).rotateInbound(3L);
    }

    @Test
    void failureOnOneInboundDoesNotStopTheRound() {
        Mockito.when(inboundService.list(any(QueryWrapper.class))).thenReturn(Arrays.asList(
                inbound(1L, 0L, null), inbound(2L, 0L, null)));
        Mockito.when(inboundService.rotateInbound(1L)).thenThrow(new IllegalStateException("端口已耗尽"));

        Assertions.assertEquals(1, task.rotateExpiredInbounds(NOW));
        Mockito.verify(inboundService).rotateInbound(2L);
    }

    @Test
    void disabledRotationDoesNothing() {
        fleetProperties.getRotation().setEnabled(false);

        task.rotateExpiredInbounds();

        Mockito.verify(inboundService, Mockito.never()).rotateInbound(anyLong());
        Mockito.verifyNoInteractions(inboundTemplateService);
    }

    private Inbound inbound(Long id, Long createdTime, Long lastRotatedTime) {
        Inbound inbound = new Inbound();
        inbound.setId(id);
        inbound.setTag("tpl_1");
        inbound.setCreatedTime(createdTime);
        inbound.setLastRotatedTime(lastRotatedTime);
        return inbound;
    }
}
