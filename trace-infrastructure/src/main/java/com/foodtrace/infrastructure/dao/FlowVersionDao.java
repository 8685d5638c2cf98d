package com.foodtrace.infrastructure.dao;

import com.foodtrace.infrastructure.dao.po.FlowVersionPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * Flow version DAO.
 */
@Mapper
public interface FlowVersionDao {

    int insert(FlowVersionPO po);

    int updateStatus(FlowVersionPO po);

    /**
     * Writes the graph only where {@code status = 'DRAFT'}.
     */
    int updateGraphIfDraft(FlowVersionPO po);

    FlowVersionPO selectById(@Param("id") Long id);

    FlowVersionPO selectByIdForUpdate(@Param("id") Long id);

    List<FlowVersionPO> selectByDefinitionId(@Param("flowDefinitionId") Long flowDefinitionId);

    FlowVersionPO selectOpenDraftByDefinitionId(@Param("flowDefinitionId") Long flowDefinitionId);

    FlowVersionPO selectLatestPublishedByDefinitionId(@Param("flowDefinitionId") Long flowDefinitionId);
}
