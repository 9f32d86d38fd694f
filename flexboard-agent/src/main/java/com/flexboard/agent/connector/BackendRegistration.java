package com.flexboard.agent.connector;

import com.flexboard.agent.model.DataSourceKind;
import com.flexboard.agent.pool.PoolFactory;

/**
 * A connector together with the pool factory that supplies its handles.
 *
 * <p>Binding both to one handle type keeps the dispatcher from handing a connector a handle
 * it cannot use.
 *
 * @param kind data source kind served
 * @param connector query executor
 * @param poolFactory per-key pool factory
 * @param <H> handle type
 */
public record BackendRegistration<H>(DataSourceKind kind, Connector<H> connector, PoolFactory<H> poolFactory) {
}
