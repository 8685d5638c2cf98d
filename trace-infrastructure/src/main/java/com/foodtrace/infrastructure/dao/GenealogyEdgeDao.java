package com.foodtrace.infrastructure.dao;

import com.foodtrace.infrastructure.dao.po.GenealogyEdgePO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Collection;
import java.util.List;

/**
 * Genealogy edge DAO. Insert and select only.
 */
@Mapper
public interface GenealogyEdgeDao {

    int insert(GenealogyEdgePO po);

    void advisoryLockGenealogy();

    List<GenealogyEdgePO> selectByChildLotIds(@Param("ids") Collection<Long> ids);

    List<GenealogyEdgePO> selectByParentLotIds(@Param("ids") Collection<Long> ids);
}
