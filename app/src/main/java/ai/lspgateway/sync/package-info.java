@NullMarked
package ai.lspgateway.sync;

import org.jspecify.annotations.NullMarked;
