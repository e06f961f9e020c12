package com.ryuqq.gateway.adapter.inmemory;

import com.ryuqq.gateway.core.spi.CoordinatorClient;
import com.ryuqq.gateway.testkit.contract.AbstractCoordinatorClientContractTest;

/**
 * Contract test for {@link InMemoryCoordinatorClient}.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
class InMemoryCoordinatorClientContractTest extends AbstractCoordinatorClientContractTest {

    @Override
    protected CoordinatorClient createClient() {
        return new InMemoryCoordinatorClient();
    }
}
