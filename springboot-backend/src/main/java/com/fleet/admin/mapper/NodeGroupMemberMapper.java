package com.fleet.admin.mapper;

import com.fleet.admin.entity.NodeGroupMember;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface NodeGroupMemberMapper extends BaseMapper<NodeGroupMember> {

    @Select("SELECT group_id FROM node_group_member WHERE node_id = #{nodeId}")
    List<Long> selectGroupIdsByNode(@Param("nodeId") Long nodeId);

    @Select("SELECT node_id FROM node_group_member WHERE group_id = #{groupId}")
    List<Long> selectNodeIdsByGroup(@Param("groupId") Long groupId);
}
