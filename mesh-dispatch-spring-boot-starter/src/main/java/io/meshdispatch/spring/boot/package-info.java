/**
 * Spring Boot auto-configuration for mesh dispatch.
 */
package io.meshdispatch.spring.boot;
