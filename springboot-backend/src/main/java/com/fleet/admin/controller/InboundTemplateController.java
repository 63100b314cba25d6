package com.fleet.admin.controller;

import com.fleet.admin.common.dto.InboundTemplateDto;
import com.fleet.admin.common.dto.InboundTemplateUpdateDto;
import com.fleet.admin.common.lang.R;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * <p>
 * 入站模板前端控制器
 * </p>
 */
@RestController
@CrossOrigin
@RequestMapping("/api/v1/template")
public class InboundTemplateController extends BaseController {

    @PostMapping("/create")
    public R create(@Validated @RequestBody InboundTemplateDto templateDto) {
        return inboundTemplateService.createTemplate(templateDto);
    }

    @PostMapping("/list")
    public R readAll() {
        return inboundTemplateService.getAllTemplates();
    }

    @PostMapping("/update")
    public R update(@Validated @RequestBody InboundTemplateUpdateDto templateUpdateDto) {
        return inboundTemplateService.updateTemplate(templateUpdateDto);
    }

    @PostMapping("/delete")
    public R delete(@RequestBody Map<String, Object> params) {
        Long id = Long.valueOf(params.get("id").toString());
        return inboundTemplateService.deleteTemplate(id);
    }

    /**
     * 把分组的模板同步到分组内所有节点
     */
    @PostMapping("/sync")
    public R sync(@RequestBody Map<String, Object> params) {
        Long groupId = Long.valueOf(params.get("groupId").toString());
        return inboundTemplateService.syncGroup(groupId);
    }

    @PostMapping("/rotate")
    public R rotate(@RequestBody Map<String, Object> params) {
        Long inboundId = Long.valueOf(params.get("inboundId").toString());
        return inboundTemplateService.rotateInbound(inboundId);
    }

}
