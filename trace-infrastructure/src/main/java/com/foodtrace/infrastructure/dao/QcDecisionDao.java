package com.foodtrace.infrastructure.dao;

import com.foodtrace.infrastructure.dao.po.QcDecisionPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Collection;
import java.util.List;

@Mapper
public interface QcDecisionDao {

    int insert(QcDecisionPO po);

    List<QcDecisionPO> selectByLotId(@Param("lotId") Long lotId);

    List<QcDecisionPO> selectByLotIds(@Param("ids") Collection<Long> ids);
}
