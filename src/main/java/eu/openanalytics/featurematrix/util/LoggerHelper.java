/**
 * Phaedra II
 *
 * Copyright (C) 2016-2025 Open Analytics
 *
 * ===========================================================================
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the Apache License as published by
 * The Apache Software Foundation, either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * Apache License for more details.
 *
 * You should have received a copy of the Apache License
 * along with this program.  If not, see <http://www.apache.org/licenses/>
 */
package eu.openanalytics.featurematrix.util;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.event.Level;

public class LoggerHelper {

	/**
	 * Anything that can identify the work a log line belongs to.
	 */
	public interface LogContext {
		String getLogPrefix();
	}

	/**
	 * Logs a formatted message at INFO, prefixed with the context. When the last argument is a
	 * {@link Throwable}, the message is logged at WARN with the stack trace.
	 */
	public static void log(Logger logger, LogContext ctx, String message, Object... args) {
		Throwable throwable = args.length > 0 && args[args.length - 1] instanceof Throwable t ? t : null;
		log(logger, throwable == null ? Level.INFO : Level.WARN, ctx, message, args);
	}

	public static void log(Logger logger, Level level, LogContext ctx, String message, Object... args) {
		String prefix = ctx == null ? "" : ctx.getLogPrefix() + " ";
		Throwable throwable = args.length > 0 && args[args.length - 1] instanceof Throwable t ? t : null;
		Object[] formatArgs = throwable == null ? args : Arrays.copyOf(args, args.length - 1);
		String formatted = prefix + (formatArgs.length == 0 ? message : String.format(message, formatArgs));
		switch (level) {
		case ERROR:
			logger.error(formatted, throwable);
			break;
		case WARN:
			logger.warn(formatted, throwable);
			break;
		case DEBUG:
			logger.debug(formatted, throwable);
			break;
		case TRACE:
			logger.trace(formatted, throwable);
			break;
		default:
			logger.info(formatted, throwable);
		}
	}
}
