package io.procura.backend.workflow;

import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for post-commit work that talks to slow collaborators, such as the portal upload
 * hand-off. Tasks inherit the MDC of the thread that scheduled them so their log lines keep the
 * request id.
 */
@Configuration
public class WorkflowAsyncConfig implements AsyncConfigurer {

  public static final String EXECUTOR = "workflowTaskExecutor";

  private static final Logger log = LoggerFactory.getLogger(WorkflowAsyncConfig.class);

  @Bean(name = EXECUTOR)
  public ThreadPoolTaskExecutor workflowTaskExecutor() {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("workflow-");
    executor.setTaskDecorator(mdcPropagatingDecorator());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }

  @Override
  public Executor getAsyncExecutor() {
    return workflowTaskExecutor();
  }

  @Override
  public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
    return (ex, method, params) ->
        log.error("Async workflow task {} failed", method.getName(), ex);
  }

  static TaskDecorator mdcPropagatingDecorator() {
    return runnable -> {
      var context = MDC.getCopyOfContextMap();
      return () -> {
        var previous = MDC.getCopyOfContextMap();
        if (context != null) {
          MDC.setContextMap(context);
        } else {
          MDC.clear();
        }
        try {
          runnable.run();
        } finally {
          if (previous != null) {
            MDC.setContextMap(previous);
          } else {
            MDC.clear();
          }
        }
      };
    };
  }
}
