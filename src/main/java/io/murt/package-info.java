/**
 * <p>A request template proxy built on Mu Server.</p>
 * <p>Named request templates are declared in a YAML file and invoked by posting their name and parameters
 * to <code>/send-request</code>. To start a server, use {@link io.murt.MurtServerBuilder#murtServer()}.</p>
 * @see io.murt.MurtServerBuilder
 */
package io.murt;
