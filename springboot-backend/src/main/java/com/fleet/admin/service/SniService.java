package com.fleet.admin.service;

import com.fleet.admin.entity.SniPool;
import com.baomidou.mybatisplus.extension.service.IService;

public interface SniService extends IService<SniPool> {

    String getBestSni(Long nodeId);
}
