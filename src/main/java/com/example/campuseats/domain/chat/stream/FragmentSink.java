package com.example.campuseats.domain.chat.stream;

@FunctionalInterface
public interface FragmentSink {

    /**
     * @throws TurnCancelledException when the client is gone
     */
    void emit(Fragment fragment);
}
