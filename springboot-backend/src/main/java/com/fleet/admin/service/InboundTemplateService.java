package com.fleet.admin.service;

import com.fleet.admin.common.dto.InboundTemplateDto;
import com.fleet.admin.common.dto.InboundTemplateUpdateDto;
import com.fleet.admin.common.lang.R;
import com.fleet.admin.entity.InboundTemplate;
import com.fleet.admin.entity.Node;
import com.baomidou.mybatisplus.extension.service.IService;

import java.util.List;

public interface InboundTemplateService extends IService<InboundTemplate> {

    /**
     * 节点所在分组的全部启用模板，按名称排序；
     * 结果为空且节点属于 Default 分组时自动创建默认 VLESS Reality 模板
     */
    List<InboundTemplate> resolveTemplates(Node node);

    /**
     * 把分组的全部启用模板实例化到分组内每个节点
     *
     * @return 成功实例化的入站数量
     */
    int syncGroupInbounds(Long groupId);

    /**
     * 轮换分组内所有模板入站
     *
     * @return 成功轮换的入站数量
     */
    int rotateGroupInbounds(Long groupId);

    R createTemplate(InboundTemplateDto templateDto);

    R getAllTemplates();

    R updateTemplate(InboundTemplateUpdateDto templateUpdateDto);

    R deleteTemplate(Long id);

    R syncGroup(Long groupId);

    R rotateInbound(Long inboundId);
}
