package org.javai.springai.evolution.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.ai.chat.client.ChatClient;

class ChatClientTextGeneratorTest {

	@Test
	void returnsResponseContent() {
		ChatClient client = mock(ChatClient.class, Mockito.RETURNS_DEEP_STUBS);
		when(client.prompt().call().content()).thenReturn("ROOT CAUSES:\n- missing step");

		TextGenerator generator = new ChatClientTextGenerator(client);

		assertThat(generator.generate("why did it fail?")).isEqualTo("ROOT CAUSES:\n- missing step");
		verify(client.prompt()).user("why did it fail?");
		verify(client.prompt(), never()).system(Mockito.anyString());
	}

	@Test
	void sendsSystemMessageWhenConfigured() {
		ChatClient client = mock(ChatClient.class, Mockito.RETURNS_DEEP_STUBS);
		when(client.prompt().call().content()).thenReturn("ok");

		new ChatClientTextGenerator(client, "You improve agent instructions.").generate("prompt");

		verify(client.prompt()).system("You improve agent instructions.");
	}

	@Test
	void wrapsClientFailures() {
		ChatClient client = mock(ChatClient.class, Mockito.RETURNS_DEEP_STUBS);
		when(client.prompt().call().content()).thenThrow(new IllegalStateException("rate limited"));

		TextGenerator generator = new ChatClientTextGenerator(client);

		assertThatThrownBy(() -> generator.generate("prompt"))
				.isInstanceOf(GenerationException.class)
				.hasMessageContaining("rate limited")
				.hasCauseInstanceOf(IllegalStateException.class);
	}

	@Test
	void missingContentIsAFailure() {
		ChatClient client = mock(ChatClient.class, Mockito.RETURNS_DEEP_STUBS);
		when(client.prompt().call().content()).thenReturn(null);

		assertThatThrownBy(() -> new ChatClientTextGenerator(client).generate("prompt"))
				.isInstanceOf(GenerationException.class)
				.hasMessageContaining("no content");
	}
}
