@NullMarked
package ai.lspgateway;

import org.jspecify.annotations.NullMarked;
