package com.foodtrace.infrastructure.repository.qc;

import com.foodtrace.domain.qc.adapter.repository.IQcGateRepository;
import com.foodtrace.domain.qc.model.entity.QcGateEntity;
import com.foodtrace.infrastructure.dao.QcGateDao;
import com.foodtrace.infrastructure.dao.po.QcGatePO;
import com.foodtrace.infrastructure.util.JsonCodec;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

@Repository
public class QcGateRepositoryImpl implements IQcGateRepository {

    private final QcGateDao qcGateDao;
    private final JsonCodec jsonCodec;

    public QcGateRepositoryImpl(QcGateDao qcGateDao, JsonCodec jsonCodec) {
        this.qcGateDao = qcGateDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public QcGateEntity save(QcGateEntity entity) {
        entity.validate();
        QcGatePO po = QcGatePO.builder()
                .gateNumber(entity.getGateNumber())
                .name(entity.getName())
                .gateType(entity.getGateType())
                .ccp(Boolean.TRUE.equals(entity.getCcp()))
                .checklist(jsonCodec.writeChecklist(entity.getChecklist()))
                .createdAt(entity.getCreatedAt())
                .build();
        qcGateDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public QcGateEntity findById(Long id) {
        QcGatePO po = qcGateDao.selectById(id);
        return po == null ? null : toEntity(po);
    }

    @Override
    public QcGateEntity findByGateNumber(Integer gateNumber) {
        QcGatePO po = qcGateDao.selectByGateNumber(gateNumber);
        return po == null ? null : toEntity(po);
    }

    @Override
    public List<QcGateEntity> findByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return Collections.emptyList();
        }
        return qcGateDao.selectByIds(ids).stream().map(this::toEntity).collect(Collectors.toList());
    }

    @Override
    public List<QcGateEntity> findAll() {
        return qcGateDao.selectAll().stream().map(this::toEntity).collect(Collectors.toList());
    }

    private QcGateEntity toEntity(QcGatePO po) {
        QcGateEntity entity = new QcGateEntity();
        entity.setId(po.getId());
        entity.setGateNumber(po.getGateNumber());
        entity.setName(po.getName());
        entity.setGateType(po.getGateType());
        entity.setCcp(po.getCcp());
        entity.setChecklist(jsonCodec.readChecklist(po.getChecklist()));
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }
}
