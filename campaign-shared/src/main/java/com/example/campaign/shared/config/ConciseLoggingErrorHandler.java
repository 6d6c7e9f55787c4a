package com.example.campaign.shared.config;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.util.backoff.BackOff;

/**
 * Logs one structured line per failed record instead of a stack trace per retry.
 * Retry and dead-letter routing are left to {@link DefaultErrorHandler}.
 */
public class ConciseLoggingErrorHandler extends DefaultErrorHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConciseLoggingErrorHandler.class);

    public ConciseLoggingErrorHandler(DeadLetterPublishingRecoverer deadLetterPublishingRecoverer, BackOff backOff) {
        super(deadLetterPublishingRecoverer, backOff);
    }

    @Override
    public boolean handleOne(Exception thrownException, ConsumerRecord<?, ?> record, Consumer<?, ?> consumer, MessageListenerContainer container) {
        LOGGER.error(
            "Error processing record. topic={}, partition={}, offset={}, key={}, exception_message='{}'",
            record.topic(),
            record.partition(),
            record.offset(),
            record.key(),
            thrownException.getCause() != null ? thrownException.getCause().getMessage() : thrownException.getMessage()
        );
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Full stack trace for failed record:", thrownException);
        }
        return super.handleOne(thrownException, record, consumer, container);
    }
}
