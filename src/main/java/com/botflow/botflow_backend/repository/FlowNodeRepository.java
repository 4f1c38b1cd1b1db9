package com.botflow.botflow_backend.repository;

import com.botflow.botflow_backend.model.domain.FlowNode;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface FlowNodeRepository extends JpaRepository<FlowNode, Long> {
    List<FlowNode> findByBotIdAndDeletedFalseOrderByIdAsc(Long botId);
}
