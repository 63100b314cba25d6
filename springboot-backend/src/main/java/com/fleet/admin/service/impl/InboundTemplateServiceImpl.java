package com.fleet.admin.service.impl;

import com.fleet.admin.common.dto.InboundTemplateDto;
import com.fleet.admin.common.dto.InboundTemplateUpdateDto;
import com.fleet.admin.common.enums.InboundProtocol;
import com.fleet.admin.common.exception.FleetException;
import com.fleet.admin.common.lang.R;
import com.fleet.admin.entity.Inbound;
import com.fleet.admin.entity.InboundTemplate;
import com.fleet.admin.entity.Node;
import com.fleet.admin.entity.NodeGroup;
import com.fleet.admin.mapper.InboundTemplateMapper;
import com.fleet.admin.mapper.NodeGroupMapper;
import com.fleet.admin.mapper.NodeGroupMemberMapper;
import com.fleet.admin.service.InboundService;
import com.fleet.admin.service.InboundTemplateService;
import com.fleet.admin.service.NodeService;
import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeanUtils;
import org.springframework.stereotype.Service;

import javax.annotation.Resource;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <p>
 * 入站模板服务实现类
 * </p>
 */
@Slf4j
@Service
public class InboundTemplateServiceImpl extends ServiceImpl<InboundTemplateMapper, InboundTemplate> implements InboundTemplateService {

    // 常量定义
    public static final String DEFAULT_GROUP_NAME = "Default";
    public static final String DEFAULT_TEMPLATE_NAME = "VLESS Reality";
    private static final String DEFAULT_TEMPLATE_PROTOCOL = "vless";
    private static final String DEFAULT_SETTINGS_TEMPLATE = "{\"clients\":[],\"decryption\":\"none\"}";
    private static final String DEFAULT_STREAM_SETTINGS_TEMPLATE = "{\"network\":\"tcp\",\"security\":\"reality\","
            + "\"reality_settings\":{\"show\":false,\"xver\":0,\"dest\":\"drive.google.com:443\","
            + "\"server_names\":[\"drive.google.com\"],\"private_key\":\"\",\"short_ids\":[\"\"]}}";
    private static final int DEFAULT_TEMPLATE_PORT = 10000;
    private static final int TEMPLATE_STATUS_ACTIVE = 1;

    @Resource
    private NodeGroupMapper nodeGroupMapper;

    @Resource
    private NodeGroupMemberMapper nodeGroupMemberMapper;

    @Resource
    private NodeService nodeService;

    @Resource
    private InboundService inboundService;

    @Override
    public List<InboundTemplate> resolveTemplates(Node node) {
        List<Long> groupIds = nodeGroupMemberMapper.selectGroupIdsByNode(node.getId());
        if (groupIds == null || groupIds.isEmpty()) {
            return Collections.emptyList();
        }

        List<InboundTemplate> templates = this.list(new QueryWrapper<InboundTemplate>()
                .in("target_group_id", groupIds)
                .eq("is_active", true)
                .orderByAsc("name"));
        Map<Long, InboundTemplate> unique = new LinkedHashMap<>();
        for (InboundTemplate template : templates) {
            unique.putIfAbsent(template.getId(), template);
        }
        if (!unique.isEmpty()) {
            return new ArrayList<>(unique.values());
        }

        NodeGroup defaultGroup = findDefaultGroup();
        if (defaultGroup == null || !groupIds.contains(defaultGroup.getId())) {
            return Collections.emptyList();
        }
        return Collections.singletonList(bootstrapDefaultTemplate(defaultGroup.getId()));
    }

    @Override
    public int syncGroupInbounds(Long groupId) {
        List<InboundTemplate> templates = this.list(new QueryWrapper<InboundTemplate>()
                .eq("target_group_id", groupId)
                .eq("is_active", true)
                .orderByAsc("name"));
        List<Long> nodeIds = nodeGroupMemberMapper.selectNodeIdsByGroup(groupId);
        if (templates.isEmpty() || nodeIds == null || nodeIds.isEmpty()) {
            return 0;
        }

        List<Node> nodes = nodeService.listByIds(nodeIds);
        log.info("同步分组 {}：{} 个模板，{} 个节点", groupId, templates.size(), nodes.size());
        int synced = 0;
        for (Node node : nodes) {
            for (InboundTemplate template : templates) {
                try {
                    inboundService.materializeEndpoint(node, template);
                    synced++;
                } catch (Exception e) {
                    log.error("模板 {} 同步到节点 {}({}) 失败: {}", template.getId(), node.getId(), node.getName(), e.getMessage());
                }
            }
        }
        return synced;
    }

    @Override
    public int rotateGroupInbounds(Long groupId) {
        List<Long> nodeIds = nodeGroupMemberMapper.selectNodeIdsByGroup(groupId);
        if (nodeIds == null || nodeIds.isEmpty()) {
            return 0;
        }
        List<Inbound> inbounds = inboundService.list(new QueryWrapper<Inbound>()
                .in("node_id", nodeIds)
                .likeRight("tag", InboundServiceImpl.TAG_PREFIX));
        int rotated = 0;
        for (Inbound inbound : inbounds) {
            try {
                inboundService.rotateInbound(inbound.getId());
                rotated++;
            } catch (Exception e) {
                log.warn("入站 {} 轮换失败: {}", inbound.getId(), e.getMessage());
            }
        }
        return rotated;
    }

    @Override
    public R createTemplate(InboundTemplateDto templateDto) {
        String error = validateTemplate(templateDto.getProtocol(), templateDto.getPortRangeStart(), templateDto.getPortRangeEnd());
        if (error != null) {
            return R.err(error);
        }
        if (nodeGroupMapper.selectById(templateDto.getTargetGroupId()) == null) {
            return R.err("目标分组不存在");
        }

        InboundTemplate template = new InboundTemplate();
        BeanUtils.copyProperties(templateDto, template);
        template.setProtocol(InboundProtocol.of(templateDto.getProtocol()).getValue());
        long now = System.currentTimeMillis();
        template.setCreatedTime(now);
        template.setUpdatedTime(now);
        template.setStatus(TEMPLATE_STATUS_ACTIVE);
        this.save(template);

        if (Boolean.TRUE.equals(template.getIsActive())) {
            syncGroupInbounds(template.getTargetGroupId());
        }
        return R.ok(template);
    }

    @Override
    public R getAllTemplates() {
        return R.ok(this.list(new QueryWrapper<InboundTemplate>().orderByAsc("target_group_id", "name")));
    }

    @Override
    public R updateTemplate(InboundTemplateUpdateDto templateUpdateDto) {
        InboundTemplate template = this.getById(templateUpdateDto.getId());
        if (template == null) {
            return R.err("模板不存在");
        }
        String error = validateTemplate(template.getProtocol(), templateUpdateDto.getPortRangeStart(), templateUpdateDto.getPortRangeEnd());
        if (error != null) {
            return R.err(error);
        }

        template.setName(templateUpdateDto.getName());
        template.setSettingsTemplate(templateUpdateDto.getSettingsTemplate());
        template.setStreamSettingsTemplate(templateUpdateDto.getStreamSettingsTemplate());
        template.setPortRangeStart(templateUpdateDto.getPortRangeStart());
        template.setPortRangeEnd(templateUpdateDto.getPortRangeEnd());
        if (templateUpdateDto.getRenewIntervalMins() != null) {
            template.setRenewIntervalMins(templateUpdateDto.getRenewIntervalMins());
        }
        if (templateUpdateDto.getIsActive() != null) {
            template.setIsActive(templateUpdateDto.getIsActive());
        }
        template.setUpdatedTime(System.currentTimeMillis());
        this.updateById(template);

        if (Boolean.TRUE.equals(template.getIsActive())) {
            syncGroupInbounds(template.getTargetGroupId());
        }
        return R.ok(template);
    }

    @Override
    public R deleteTemplate(Long id) {
        InboundTemplate template = this.getById(id);
        if (template == null) {
            return R.err("模板不存在");
        }
        inboundService.removeByTemplate(id);
        this.removeById(id);
        return R.ok();
    }

    @Override
    public R syncGroup(Long groupId) {
        if (nodeGroupMapper.selectById(groupId) == null) {
            return R.err("分组不存在");
        }
        return R.ok(syncGroupInbounds(groupId));
    }

    @Override
    public R rotateInbound(Long inboundId) {
        try {
            return R.ok(inboundService.rotateInbound(inboundId));
        } catch (FleetException e) {
            return R.err(e.getMessage());
        }
    }

    // ========== 辅助方法 ==========

    private InboundTemplate bootstrapDefaultTemplate(Long groupId) {
        InboundTemplate existing = this.getOne(new QueryWrapper<InboundTemplate>()
                .eq("target_group_id", groupId)
                .eq("name", DEFAULT_TEMPLATE_NAME), false);
        if (existing != null) {
            return existing;
        }

        log.info("Default 分组 {} 没有任何模板，创建默认模板 {}", groupId, DEFAULT_TEMPLATE_NAME);
        InboundTemplate template = new InboundTemplate();
        template.setName(DEFAULT_TEMPLATE_NAME);
        template.setProtocol(DEFAULT_TEMPLATE_PROTOCOL);
        template.setSettingsTemplate(DEFAULT_SETTINGS_TEMPLATE);
        template.setStreamSettingsTemplate(DEFAULT_STREAM_SETTINGS_TEMPLATE);
        template.setTargetGroupId(groupId);
        template.setPortRangeStart(DEFAULT_TEMPLATE_PORT);
        template.setPortRangeEnd(DEFAULT_TEMPLATE_PORT);
        template.setRenewIntervalMins(0);
        template.setIsActive(true);
        long now = System.currentTimeMillis();
        template.setCreatedTime(now);
        template.setUpdatedTime(now);
        template.setStatus(TEMPLATE_STATUS_ACTIVE);
        this.save(template);
        return template;
    }

    private NodeGroup findDefaultGroup() {
        List<NodeGroup> groups = nodeGroupMapper.selectList(new QueryWrapper<NodeGroup>()
                .eq("name", DEFAULT_GROUP_NAME)
                .orderByAsc("id"));
        return groups == null || groups.isEmpty() ? null : groups.get(0);
    }

    private String validateTemplate(String protocol, Integer portRangeStart, Integer portRangeEnd) {
        if (InboundProtocol.of(protocol) == null) {
            return "不支持的协议: " + protocol;
        }
        if (portRangeStart == null || portRangeEnd == null
                || portRangeStart < 1 || portRangeEnd > 65535 || portRangeStart > portRangeEnd) {
            return "端口范围必须满足 1 ≤ 起始端口 ≤ 结束端口 ≤ 65535";
        }
        return null;
    }
}
