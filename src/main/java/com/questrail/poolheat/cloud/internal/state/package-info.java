/**
 * Device state ownership: confirmed baselines, optimistic shadows, revisions
 * and ordered notification delivery.
 */
package com.questrail.poolheat.cloud.internal.state;
