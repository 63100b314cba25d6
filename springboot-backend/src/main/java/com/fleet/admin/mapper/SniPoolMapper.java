package com.fleet.admin.mapper;

import com.fleet.admin.entity.SniPool;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

public interface SniPoolMapper extends BaseMapper<SniPool> {

    @Select("SELECT s.domain FROM sni_pool s " +
            "JOIN node_pinned_sni nps ON s.id = nps.sni_id " +
            "WHERE nps.node_id = #{nodeId} AND s.is_active = TRUE " +
            "ORDER BY s.health_score DESC LIMIT 1")
    String selectPinnedDomain(@Param("nodeId") Long nodeId);
}
