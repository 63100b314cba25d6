package com.fleet.admin.service.impl;

import com.fleet.admin.common.config.FleetProperties;
import com.fleet.admin.entity.Node;
import com.fleet.admin.entity.SniPool;
import com.fleet.admin.mapper.NodeMapper;
import com.fleet.admin.mapper.SniPoolMapper;
import com.fleet.admin.service.SniService;
import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import javax.annotation.Resource;

/**
 * SNI 伪装域名选择
 * 顺序：节点固定 SNI → 中转节点使用高级池 → 节点自己发现的 SNI → 全局最优 → 默认域名
 */
@Slf4j
@Service
public class SniServiceImpl extends ServiceImpl<SniPoolMapper, SniPool> implements SniService {

    private static final int MAX_TIER = 1;

    @Resource
    private NodeMapper nodeMapper;

    @Resource
    private FleetProperties fleetProperties;

    @Override
    public String getBestSni(Long nodeId) {
        String pinned = baseMapper.selectPinnedDomain(nodeId);
        if (StringUtils.isNotBlank(pinned)) {
            return pinned;
        }

        Node node = nodeMapper.selectById(nodeId);
        if (node != null && Boolean.TRUE.equals(node.getIsRelay())) {
            return orDefault(pickBest(new QueryWrapper<SniPool>()
                    .eq("is_active", true)
                    .eq("is_premium", true)
                    .le("tier", MAX_TIER)));
        }

        SniPool discovered = pickBest(new QueryWrapper<SniPool>()
                .eq("is_active", true)
                .eq("discovered_by_node_id", nodeId));
        if (discovered != null) {
            return discovered.getDomain();
        }

        return orDefault(pickBest(new QueryWrapper<SniPool>()
                .eq("is_active", true)
                .le("tier", MAX_TIER)));
    }

    private SniPool pickBest(QueryWrapper<SniPool> wrapper) {
        wrapper.orderByDesc("health_score").last("LIMIT 1");
        return this.getOne(wrapper, false);
    }

    private String orDefault(SniPool sni) {
        if (sni == null || StringUtils.isBlank(sni.getDomain())) {
            return fleetProperties.getSingbox().getDefaultSni();
        }
        return sni.getDomain();
    }
}
