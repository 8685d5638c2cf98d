package com.foodtrace.infrastructure.repository.qc;

import com.foodtrace.domain.qc.adapter.repository.IQcDecisionRepository;
import com.foodtrace.domain.qc.model.entity.QcDecisionEntity;
import com.foodtrace.infrastructure.dao.QcDecisionDao;
import com.foodtrace.infrastructure.dao.po.QcDecisionPO;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

@Repository
public class QcDecisionRepositoryImpl implements IQcDecisionRepository {

    private final QcDecisionDao qcDecisionDao;

    public QcDecisionRepositoryImpl(QcDecisionDao qcDecisionDao) {
        this.qcDecisionDao = qcDecisionDao;
    }

    @Override
    public QcDecisionEntity save(QcDecisionEntity entity) {
        QcDecisionPO po = QcDecisionPO.builder()
                .lotId(entity.getLotId())
                .qcGateId(entity.getQcGateId())
                .operatorId(entity.getOperatorId())
                .decision(entity.getDecision())
                .notes(entity.getNotes())
                .temperatureC(entity.getTemperatureC())
                .signature(entity.getSignature())
                .decidedAt(entity.getDecidedAt())
                .build();
        qcDecisionDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public List<QcDecisionEntity> findByLotId(Long lotId) {
        return qcDecisionDao.selectByLotId(lotId).stream().map(this::toEntity).collect(Collectors.toList());
    }

    @Override
    public List<QcDecisionEntity> findByLotIds(Collection<Long> lotIds) {
        if (lotIds == null || lotIds.isEmpty()) {
            return Collections.emptyList();
        }
        return qcDecisionDao.selectByLotIds(lotIds).stream().map(this::toEntity).collect(Collectors.toList());
    }

    private QcDecisionEntity toEntity(QcDecisionPO po) {
        QcDecisionEntity entity = new QcDecisionEntity();
        entity.setId(po.getId());
        entity.setLotId(po.getLotId());
        entity.setQcGateId(po.getQcGateId());
        entity.setOperatorId(po.getOperatorId());
        entity.setDecision(po.getDecision());
        entity.setNotes(po.getNotes());
        entity.setTemperatureC(po.getTemperatureC());
        entity.setSignature(po.getSignature());
        entity.setDecidedAt(po.getDecidedAt());
        return entity;
    }
}
