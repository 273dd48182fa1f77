/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.herald.output;

import io.herald.core.RunEvent;
import io.herald.core.RunListener;
import io.herald.log.LogContext;
import net.minidev.json.JSONStyle;
import net.minidev.json.JSONValue;
import org.slf4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A {@link RunListener} that writes each event as one JSON line to the
 * {@code herald.events} logger, in the envelope format:
 * <pre>
 * {"type":"SUITE_STARTING","ordinal":[0,1,0],"timeStamp":1703500000000,"threadName":"main","data":{...}}
 * {"type":"TEST_STARTING","ordinal":[0,1,1,0],"timeStamp":1703500000010,"threadName":"herald-worker-2","data":{...}}
 * </pre>
 * Where the lines end up is up to the logging configuration. Placed behind the sorting
 * gates it records the final, ordered stream.
 */
public class LoggingRunListener implements RunListener {

    private static final JSONStyle JSON_STYLE = new JSONStyle(JSONStyle.FLAG_PROTECT_4WEB);

    private final Logger logger;

    public LoggingRunListener() {
        this(LogContext.EVENT_LOGGER);
    }

    public LoggingRunListener(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void onEvent(RunEvent event) {
        if (!logger.isInfoEnabled()) {
            return;
        }
        logger.info(toJsonLine(event));
    }

    public static String toJsonLine(RunEvent event) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("type", event.getType().name());
        envelope.put("ordinal", event.getOrdinal() == null ? null : event.getOrdinal().toList());
        envelope.put("timeStamp", event.getTimeStamp());
        envelope.put("threadName", event.getThreadName());
        envelope.put("data", event.toJson());
        return JSONValue.toJSONString(envelope, JSON_STYLE);
    }

}
