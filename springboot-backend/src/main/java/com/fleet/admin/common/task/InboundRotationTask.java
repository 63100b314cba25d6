package com.fleet.admin.common.task;

import com.fleet.admin.common.config.FleetProperties;
import com.fleet.admin.entity.Inbound;
import com.fleet.admin.entity.InboundTemplate;
import com.fleet.admin.service.InboundService;
import com.fleet.admin.service.InboundTemplateService;
import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import javax.annotation.Resource;
import java.util.List;

/**
 * 按模板的 renew_interval_mins 定期轮换入站端口与 SNI
 */
@Slf4j
@Component
public class InboundRotationTask {

    private static final long MINUTE_MS = 60_000L;

    @Resource
    private InboundTemplateService inboundTemplateService;

    @Resource
    private InboundService inboundService;

    @Resource
    private FleetProperties fleetProperties;

    @Scheduled(fixedDelayString = "${fleet.rotation.interval-ms:60000}")
    public void rotateExpiredInbounds() {
        if (!fleetProperties.getRotation().isEnabled()) {
            return;
        }
        rotateExpiredInbounds(System.currentTimeMillis());
    }

    /**
     * @return 本轮轮换的入站数量
     */
    public int rotateExpiredInbounds(long now) {
        List<InboundTemplate> templates = inboundTemplateService.list(new QueryWrapper<InboundTemplate>()
                .eq("is_active", true)
                .gt("renew_interval_mins", 0));
        int rotated = 0;
        for (InboundTemplate template : templates) {
            long intervalMs = template.getRenewIntervalMins() * MINUTE_MS;
            List<Inbound> inbounds = inboundService.list(new QueryWrapper<Inbound>()
                    .eq("template_id", template.getId())
                    .eq("enable", true));
            for (Inbound inbound : inbounds) {
                Long last = inbound.getLastRotatedTime() != null ? inbound.getLastRotatedTime() : inbound.getCreatedTime();
                if (last != null && now - last < intervalMs) {
                    continue;
                }
                try {
                    inboundService.rotateInbound(inbound.getId());
                    rotated++;
                } catch (Exception e) {
                    log.warn("入站 {} 定时轮换失败: {}", inbound.getTag(), e.getMessage());
                }
            }
        }
        if (rotated > 0) {
            log.info("定时轮换完成，共轮换 {} 个入站", rotated);
        }
        return rotated;
    }
}
