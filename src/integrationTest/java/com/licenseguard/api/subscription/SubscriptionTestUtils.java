package com.licenseguard.api.subscription;

import com.stripe.model.Event;
import com.stripe.model.EventDataObjectDeserializer;
import com.stripe.model.Price;
import com.stripe.model.StripeObject;
import com.stripe.model.SubscriptionItem;
import com.stripe.model.SubscriptionItemCollection;
import com.stripe.model.checkout.Session;
import lombok.NonNull;
import lombok.val;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

public class SubscriptionTestUtils {

    @NonNull
    static String randomStripeId(@NonNull String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "");
    }

    @NonNull
    static Event buildStripeEvent(@NonNull String id, @NonNull String type, @NonNull StripeObject dataObject) {
        // event data objects are hard to construct from json, so the event is mocked.
        val event = mock(Event.class);
        lenient().when(event.getId()).thenReturn(id);
        lenient().when(event.getType()).thenReturn(type);

        val deserializer = mock(EventDataObjectDeserializer.class);
        lenient().when(deserializer.getObject()).thenReturn(Optional.of(dataObject));
        lenient().when(event.getDataObjectDeserializer()).thenReturn(deserializer);

        lenient().when(event.toJson()).thenReturn("{}");
        return event;
    }

    @NonNull
    static Session buildStripeCheckoutSession(@NonNull String subscriptionId, Long userId) {
        val session = new Session();
        session.setId(randomStripeId("cs"));
        session.setMode("subscription");
        session.setStatus("complete");
        session.setPaymentStatus("paid");
        session.setSubscription(subscriptionId);
        session.setCustomer(randomStripeId("cus"));
        if (userId != null) {
            session.setMetadata(Map.of(StripeSnapshots.USER_ID_METADATA_KEY, userId.toString()));
        }

        return session;
    }

    @NonNull
    static com.stripe.model.Subscription buildStripeSubscription(@NonNull String id, @NonNull String status, String priceId) {
        val subscription = new com.stripe.model.Subscription();
        subscription.setId(id);
        subscription.setStatus(status);
        subscription.setCustomer(randomStripeId("cus"));

        val now = OffsetDateTime.now().toEpochSecond();
        subscription.setCurrentPeriodStart(now);
        subscription.setStartDate(now);
        subscription.setCurrentPeriodEnd(now + 30 * 24 * 60 * 60);
        subscription.setCancelAtPeriodEnd(false);

        if (priceId != null) {
            val items = new SubscriptionItemCollection();
            items.setData(List.of(buildSubscriptionItem(priceId)));
            subscription.setItems(items);
        }

        return subscription;
    }

    @NonNull
    static SubscriptionItem buildSubscriptionItem(@NonNull String priceId) {
        val price = new Price();
        price.setId(priceId);

        val subscriptionItem = new SubscriptionItem();
        subscriptionItem.setPrice(price);
        return subscriptionItem;
    }
}
