package com.poc.svc.ingestion.broker;

import com.poc.svc.ingestion.exception.BrokerAccessException;

public interface BrokerGateway {

    QueueSession open(String queue) throws BrokerAccessException;
}
