package com.foodtrace.infrastructure.dao;

import com.foodtrace.infrastructure.dao.po.QcGatePO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Collection;
import java.util.List;

@Mapper
public interface QcGateDao {

    int insert(QcGatePO po);

    QcGatePO selectById(@Param("id") Long id);

    QcGatePO selectByGateNumber(@Param("gateNumber") Integer gateNumber);

    List<QcGatePO> selectByIds(@Param("ids") Collection<Long> ids);

    List<QcGatePO> selectAll();
}
