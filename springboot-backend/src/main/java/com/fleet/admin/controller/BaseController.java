package com.fleet.admin.controller;

import com.fleet.admin.service.InboundTemplateService;
import com.fleet.admin.service.NodeConfigService;
import org.springframework.beans.factory.annotation.Autowired;

public class BaseController {

    @Autowired
    NodeConfigService nodeConfigService;

    @Autowired
    InboundTemplateService inboundTemplateService;

}
