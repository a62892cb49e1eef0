/**
 * Spring Boot auto-configuration for the task queue: {@code queue.*} properties, message
 * store selection and optional Micrometer metrics.
 */
package io.taskqueue.spring.boot;
