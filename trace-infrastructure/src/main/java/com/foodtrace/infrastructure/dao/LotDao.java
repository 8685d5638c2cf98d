package com.foodtrace.infrastructure.dao;

import com.foodtrace.infrastructure.dao.po.LotPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Collection;
import java.util.List;

/**
 * Lot DAO.
 */
@Mapper
public interface LotDao {

    int insert(LotPO po);

    int updateWithVersion(LotPO po);

    LotPO selectById(@Param("id") Long id);

    LotPO selectByIdForUpdate(@Param("id") Long id);

    LotPO selectByCode(@Param("lotCode") String lotCode);

    List<LotPO> selectByIds(@Param("ids") Collection<Long> ids);

    List<LotPO> selectByRunId(@Param("runId") Long runId);

    List<LotPO> selectByRunIdAndStepIndex(@Param("runId") Long runId, @Param("stepIndex") int stepIndex);
}
