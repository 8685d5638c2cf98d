package com.foodtrace.infrastructure.dao;

import com.foodtrace.infrastructure.dao.po.RunStepExecutionPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface RunStepExecutionDao {

    int batchInsert(@Param("list") List<RunStepExecutionPO> list);

    int update(RunStepExecutionPO po);

    List<RunStepExecutionPO> selectByRunId(@Param("runId") Long runId);
}
