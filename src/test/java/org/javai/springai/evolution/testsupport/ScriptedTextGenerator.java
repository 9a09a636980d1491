package org.javai.springai.evolution.testsupport;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.javai.springai.evolution.generation.GenerationException;
import org.javai.springai.evolution.generation.TextGenerator;

/**
 * Deterministic {@link TextGenerator} for tests. Answers either from a queue of canned responses
 * or from a function of the prompt, and records every prompt it receives.
 */
public final class ScriptedTextGenerator implements TextGenerator {

	private final Function<String, String> responder;
	private final List<String> prompts = Collections.synchronizedList(new ArrayList<>());

	private ScriptedTextGenerator(Function<String, String> responder) {
		this.responder = responder;
	}

	/**
	 * Replies with the given responses in order; a {@link RuntimeException} in the list is thrown
	 * instead of returned. Fails once the script runs out.
	 */
	public static ScriptedTextGenerator replying(Object... responses) {
		Deque<Object> script = new ArrayDeque<>(List.of(responses));
		return new ScriptedTextGenerator(prompt -> {
			Object next;
			synchronized (script) {
				next = script.poll();
			}
			if (next == null) {
				throw new GenerationException("script exhausted");
			}
			if (next instanceof RuntimeException e) {
				throw e;
			}
			return (String) next;
		});
	}

	public static ScriptedTextGenerator answering(Function<String, String> responder) {
		return new ScriptedTextGenerator(Objects.requireNonNull(responder, "responder must not be null"));
	}

	@Override
	public String generate(String prompt) {
		prompts.add(prompt);
		return responder.apply(prompt);
	}

	public List<String> prompts() {
		synchronized (prompts) {
			return List.copyOf(prompts);
		}
	}

	public int invocations() {
		return prompts.size();
	}
}
