/**
 * Topic lifecycle management.
 */
package io.eventbus.topic;
