package com.mk.fx.qa.latency.execution.resource;

import com.mk.fx.qa.latency.execution.dto.controllerresponse.TaskSubmissionRequest;
import com.mk.fx.qa.latency.execution.model.BenchmarkTask;
import com.mk.fx.qa.latency.execution.model.TaskType;
import java.time.Instant;
import java.util.UUID;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

@Mapper(
    componentModel = "spring",
    imports = {UUID.class, Instant.class})
public interface TaskMapper {

  @Mapping(target = "id", expression = "java(UUID.randomUUID())")
  @Mapping(target = "createdAt", expression = "java(Instant.now())")
  @Mapping(target = "taskType", source = "taskType", qualifiedByName = "mapTaskType")
  BenchmarkTask toDomain(TaskSubmissionRequest request);

  @Named("mapTaskType")
  default TaskType mapTaskType(String taskType) {
    return TaskType.fromValue(taskType);
  }
}
