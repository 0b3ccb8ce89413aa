package com.poc.svc.ingestion.broker;

import com.poc.svc.ingestion.dto.InboundMessage;
import com.poc.svc.ingestion.exception.BrokerAccessException;

import java.util.Optional;

/**
 * 單一 queue 的專屬 broker 連線。只由擁有它的 consumer thread 使用，不需同步。
 */
public interface QueueSession extends AutoCloseable {

    String queue();

    /**
     * 拉取下一則訊息，queue 為空時回傳 empty。取得的訊息在 ack 或 requeue 之前維持 unacked。
     */
    Optional<InboundMessage> poll() throws BrokerAccessException;

    void ack(InboundMessage message) throws BrokerAccessException;

    /**
     * nack 並放回 queue 前端，broker 會再次投遞。
     */
    void requeue(InboundMessage message) throws BrokerAccessException;

    /**
     * 將所有未 ack 的訊息交還 broker 重新投遞。
     */
    void recover() throws BrokerAccessException;

    boolean isOpen();

    @Override
    void close();
}
