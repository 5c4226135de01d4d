package com.example.campuseats.global.client;

import java.util.function.Consumer;

/**
 * Opaque text generation backend.
 */
public interface GenerationEngine {

	/**
	 * Streams the reply for {@code prompt}, handing each text fragment to {@code fragmentSink}
	 * on the calling thread as soon as it arrives. An exception thrown by the sink aborts the
	 * upstream read and propagates unchanged.
	 *
	 * @throws GenerationFailedException when the engine or the network fails
	 */
	void stream(GenerationPrompt prompt, Consumer<String> fragmentSink);

	/**
	 * Sends a throwaway request so the model is loaded before the first real turn.
	 */
	void warmUp();
}
