package com.taskdrive.app.handler;

import com.taskdrive.worker.TaskContext;
import com.taskdrive.worker.TaskHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default handler: completes every task with its own payload.
 * Used only when the application defines no {@link TaskHandler} bean.
 */
public class EchoTaskHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(EchoTaskHandler.class);

    @Override
    public Map<String, Object> execute(TaskContext context) {
        log.info("Echoing payload of task {} ({} keys)", context.getTaskId(), context.getPayload().size());
        Map<String, Object> result = new LinkedHashMap<>(context.getPayload());
        result.put("echoedBy", context.getWorkerId());
        return result;
    }
}
