package com.botflow.botflow_backend.repository;

import com.botflow.botflow_backend.model.domain.FlowEdge;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface FlowEdgeRepository extends JpaRepository<FlowEdge, Long> {
    List<FlowEdge> findByBotIdAndDeletedFalseOrderByIdAsc(Long botId);
}
