@NullMarked
package ai.lspgateway.connection;

import org.jspecify.annotations.NullMarked;
