package com.example.campuseats.domain.chat.dialogue;

import com.example.campuseats.domain.chat.session.Session;
import com.example.campuseats.domain.order.OrderDraft;
import com.example.campuseats.domain.order.OrderRecord;

/**
 * The controller's verdict for one message. Nothing here touches the stored session until the
 * reply has been streamed to the end.
 *
 * @param completedOrder set only on the turn that completes an order
 */
public record TurnDecision(
	Stage stage,
	OrderDraft draft,
	Reply reply,
	OrderRecord completedOrder
) {
	public static TurnDecision of(Stage stage, OrderDraft draft, Reply reply) {
		return new TurnDecision(stage, draft, reply, null);
	}

	public static TurnDecision unchanged(Session session, Reply reply) {
		return new TurnDecision(session.getStage(), session.getDraft(), reply, null);
	}
}
