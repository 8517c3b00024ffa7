package com.taskforge.resize.application;

import com.taskforge.resize.domain.TaskResult;

import java.util.Map;

/**
 * Performs the work behind a task. Must tolerate repeated invocation for the same {@code taskId}.
 */
public interface TaskProcessor {
  TaskResult process(String taskId, Map<String, Object> payload);
}
