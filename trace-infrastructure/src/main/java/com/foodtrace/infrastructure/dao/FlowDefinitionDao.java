package com.foodtrace.infrastructure.dao;

import com.foodtrace.infrastructure.dao.po.FlowDefinitionPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * Flow definition DAO.
 */
@Mapper
public interface FlowDefinitionDao {

    int insert(FlowDefinitionPO po);

    FlowDefinitionPO selectById(@Param("id") Long id);

    FlowDefinitionPO selectByIdForUpdate(@Param("id") Long id);

    List<FlowDefinitionPO> selectAll();

    /**
     * {@code UPDATE ... SET latest_version_num = latest_version_num + 1 ... RETURNING latest_version_num}.
     */
    Integer incrementLatestVersionNum(@Param("id") Long id);
}
