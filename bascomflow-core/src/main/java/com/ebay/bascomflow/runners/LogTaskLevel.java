/************************************************************************
 Copyright 2018 eBay Inc.
 Author/Developer: Brendan McCarthy

 Licensed under the Apache License, Version 2.0 (the "License");
 you may not use this file except in compliance with the License.
 You may obtain a copy of the License at

 https://www.apache.org/licenses/LICENSE-2.0

 Unless required by applicable law or agreed to in writing, software
 distributed under the License is distributed on an "AS IS" BASIS,
 WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 See the License for the specific language governing permissions and
 limitations under the License.
 **************************************************************************/
package com.ebay.bascomflow.runners;

import org.slf4j.Logger;

/**
 * Level at which {@link LogTaskInterceptor} reports routine attempt events, since slf4j loggers take no level
 * argument.
 *
 * @author Brendan McCarthy
 */
public enum LogTaskLevel {
    INFO {
        public boolean isEnabled(Logger logger) {
            return logger.isInfoEnabled();
        }

        public void write(Logger logger, String format, Object... arguments) {
            logger.info(format, arguments);
        }
    },
    WARN {
        public boolean isEnabled(Logger logger) {
            return logger.isWarnEnabled();
        }

        public void write(Logger logger, String format, Object... arguments) {
            logger.warn(format, arguments);
        }
    },
    DEBUG {
        public boolean isEnabled(Logger logger) {
            return logger.isDebugEnabled();
        }

        public void write(Logger logger, String format, Object... arguments) {
            logger.debug(format, arguments);
        }
    },
    TRACE {
        public boolean isEnabled(Logger logger) {
            return logger.isTraceEnabled();
        }

        public void write(Logger logger, String format, Object... arguments) {
            logger.trace(format, arguments);
        }
    };

    public abstract boolean isEnabled(Logger logger);

    public abstract void write(Logger logger, String format, Object... arguments);
}
