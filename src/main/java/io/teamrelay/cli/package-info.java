/**
 * picocli command tree. Every command prints JSON on stdout, including errors.
 */
package io.teamrelay.cli;
