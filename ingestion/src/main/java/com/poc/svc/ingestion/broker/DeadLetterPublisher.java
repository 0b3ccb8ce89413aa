package com.poc.svc.ingestion.broker;

import com.poc.svc.ingestion.dto.DeadLetter;
import com.poc.svc.ingestion.exception.BrokerAccessException;

public interface DeadLetterPublisher {

    /**
     * 發佈至 dead-letter queue，回傳時 broker 已接收該訊息；失敗時原訊息不可 ack。
     */
    void publish(String deadLetterQueue, DeadLetter deadLetter) throws BrokerAccessException;
}
