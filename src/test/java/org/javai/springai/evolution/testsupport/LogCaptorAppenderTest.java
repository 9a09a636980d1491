package org.javai.springai.evolution.testsupport;

import static org.assertj.core.api.Assertions.assertThat;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogCaptorAppenderTest {

	@Test
	void capturesOnlyWhileOpenAndRestoresConfiguration() {
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		String name = LogCaptorAppenderTest.class.getName();
		org.slf4j.Logger logger = LoggerFactory.getLogger(LogCaptorAppenderTest.class);

		try (LogCaptorAppender appender = LogCaptorAppender.create(LogCaptorAppenderTest.class, Level.DEBUG)) {
			logger.debug("candidate {} recorded", "abc");
			logger.warn("parent {} is a dead end", "def");

			assertThat(context.getConfiguration().getLoggers()).containsKey(name);
			assertThat(appender.messagesAt(Level.DEBUG)).containsExactly("candidate abc recorded");
			assertThat(appender.messagesAt(Level.WARN)).containsExactly("parent def is a dead end");
			assertThat(appender.events()).hasSize(2);
		}

		assertThat(context.getConfiguration().getLoggers()).doesNotContainKey(name);
	}
}
