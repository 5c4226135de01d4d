package com.example.campuseats.domain.chat.stream;

/**
 * Raised from a fragment write once the client has disconnected. It unwinds the turn, including
 * an in-progress model read, and is not an error.
 */
public class TurnCancelledException extends RuntimeException {

    public TurnCancelledException(Throwable cause) {
        super("Client stopped reading the reply", cause);
    }
}
